package com.example.home_view.repository;

import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 宛先にメッセージが 1 件もなければ empty を返す。 */
  public OptionalLong findMaxMessageIdByRecipient(long recipientId) {
    final String sql =
        """
        SELECT MAX(message_id)
        FROM messages
        WHERE recipient_id = :recipientId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    final Long maxMessageId = jdbcTemplate.queryForObject(sql, params, Long.class);
    return maxMessageId == null ? OptionalLong.empty() : OptionalLong.of(maxMessageId);
  }
}
