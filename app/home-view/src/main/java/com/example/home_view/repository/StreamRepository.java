package com.example.home_view.repository;

import com.example.home_view.model.StreamRecord;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StreamRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // stream 名は realm 内で大文字小文字を区別しない
  public Optional<StreamRecord> findByRealmAndName(long realmId, String name) {
    final String sql =
        """
        SELECT stream_id, realm_id, name, recipient_id
        FROM streams
        WHERE realm_id = :realmId
          AND LOWER(name) = LOWER(:name)
          AND deactivated = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("realmId", realmId).addValue("name", name);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new StreamRecord(
                    rs.getLong("stream_id"),
                    rs.getLong("realm_id"),
                    rs.getString("name"),
                    rs.getLong("recipient_id")))
        .stream()
        .findFirst();
  }
}
