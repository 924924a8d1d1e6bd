package com.example.home_view.repository;

import com.example.home_view.model.BillingCustomerRecord;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class BillingCustomerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<BillingCustomerRecord> findByRealmId(long realmId) {
    final String sql =
        """
        SELECT customer_id, realm_id, sponsorship_pending
        FROM billing_customers
        WHERE realm_id = :realmId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("realmId", realmId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new BillingCustomerRecord(
                    rs.getLong("customer_id"),
                    rs.getLong("realm_id"),
                    rs.getBoolean("sponsorship_pending")))
        .stream()
        .findFirst();
  }
}
