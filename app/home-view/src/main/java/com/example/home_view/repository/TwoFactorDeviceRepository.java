package com.example.home_view.repository;

import com.example.home_view.model.TwoFactorDeviceRecord;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TwoFactorDeviceRepository {

  static final String DEFAULT_DEVICE_NAME = "default";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TwoFactorDeviceRecord> findDefaultDevice(long userId) {
    final String sql =
        """
        SELECT device_id, user_id, name, confirmed
        FROM two_factor_devices
        WHERE user_id = :userId
          AND name = :name
          AND confirmed = TRUE
        ORDER BY device_id
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("name", DEFAULT_DEVICE_NAME);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new TwoFactorDeviceRecord(
                    rs.getLong("device_id"),
                    rs.getLong("user_id"),
                    rs.getString("name"),
                    rs.getBoolean("confirmed")))
        .stream()
        .findFirst();
  }
}
