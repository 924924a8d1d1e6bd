package com.example.home_view.repository;

import com.example.common.JdbcTimestampUtils;
import com.example.home_view.model.UserActivityRecord;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserActivityRepository {

  static final List<String> UPDATE_MESSAGE_FLAG_QUERIES =
      List.of("update_message_flags", "update_message_flags_for_narrow");

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserActivityRecord> findLatestUpdateMessageFlagActivity(long userId) {
    final String sql =
        """
        SELECT user_id, query, count, last_visit
        FROM user_activity
        WHERE user_id = :userId
          AND query IN (:queries)
        ORDER BY last_visit DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("queries", UPDATE_MESSAGE_FLAG_QUERIES);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new UserActivityRecord(
                    rs.getLong("user_id"),
                    rs.getString("query"),
                    rs.getInt("count"),
                    JdbcTimestampUtils.toInstant(rs.getTimestamp("last_visit"))))
        .stream()
        .findFirst();
  }
}
