package com.example.home_view.repository;

import com.example.home_view.model.ColorScheme;
import com.example.home_view.model.TutorialStatus;
import com.example.home_view.model.UserProfileRecord;
import com.example.home_view.model.UserRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserProfileRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserProfileRecord> findActiveByUserId(long userId) {
    final String sql =
        """
        SELECT user_id, realm_id, full_name, role, is_billing_admin, color_scheme,
               default_language, tutorial_status, is_active
        FROM user_profiles
        WHERE user_id = :userId
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public long countActiveHumans(long realmId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM user_profiles
        WHERE realm_id = :realmId
          AND is_active = TRUE
          AND is_bot = FALSE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("realmId", realmId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private UserProfileRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserProfileRecord(
        rs.getLong("user_id"),
        rs.getLong("realm_id"),
        rs.getString("full_name"),
        UserRole.valueOf(rs.getString("role")),
        rs.getBoolean("is_billing_admin"),
        ColorScheme.valueOf(rs.getString("color_scheme")),
        rs.getString("default_language"),
        TutorialStatus.valueOf(rs.getString("tutorial_status")),
        rs.getBoolean("is_active"));
  }
}
