package com.example.home_view.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PreregistrationInviteRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long countByReferrer(long userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM preregistration_invites
        WHERE referred_by = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }
}
