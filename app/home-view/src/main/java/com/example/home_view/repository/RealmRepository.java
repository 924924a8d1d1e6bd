package com.example.home_view.repository;

import com.example.home_view.model.BotCreationPolicy;
import com.example.home_view.model.PlanType;
import com.example.home_view.model.Realm;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RealmRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT realm_id, string_id, name, plan_type, webathena_enabled,
             web_public_access_enabled, bot_creation_policy
      FROM realms
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Realm> findById(long realmId) {
    final String sql = SELECT_COLUMNS + "WHERE realm_id = :realmId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("realmId", realmId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<Realm> findByStringId(String stringId) {
    final String sql = SELECT_COLUMNS + "WHERE string_id = :stringId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("stringId", stringId == null ? "" : stringId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private Realm mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Realm(
        rs.getLong("realm_id"),
        rs.getString("string_id"),
        rs.getString("name"),
        PlanType.valueOf(rs.getString("plan_type")),
        rs.getBoolean("webathena_enabled"),
        rs.getBoolean("web_public_access_enabled"),
        BotCreationPolicy.valueOf(rs.getString("bot_creation_policy")));
  }
}
