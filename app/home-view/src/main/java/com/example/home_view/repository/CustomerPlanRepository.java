package com.example.home_view.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerPlanRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean existsByCustomerId(long customerId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM customer_plans WHERE customer_id = :customerId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }
}
