package com.example.home_view.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.JdbcTimestampUtils;
import com.example.home_view.model.BotCreationPolicy;
import com.example.home_view.model.PlanType;
import com.example.home_view.model.Realm;
import com.example.home_view.model.UserActivityRecord;
import com.example.home_view.model.UserRole;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class HomeViewRepositoryTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "home");
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "home");
    registry.add("spring.flyway.schemas", () -> "home");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_home");
  }

  @Autowired private RealmRepository realmRepository;
  @Autowired private UserProfileRepository userProfileRepository;
  @Autowired private StreamRepository streamRepository;
  @Autowired private MessageRepository messageRepository;
  @Autowired private UserActivityRepository userActivityRepository;
  @Autowired private BillingCustomerRepository billingCustomerRepository;
  @Autowired private CustomerPlanRepository customerPlanRepository;
  @Autowired private TwoFactorDeviceRepository twoFactorDeviceRepository;
  @Autowired private PreregistrationInviteRepository preregistrationInviteRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void seed() {
    for (String table :
        new String[] {
          "preregistration_invites",
          "two_factor_devices",
          "customer_plans",
          "billing_customers",
          "user_activity",
          "messages",
          "streams",
          "user_profiles",
          "realms"
        }) {
      jdbcTemplate.update("DELETE FROM home." + table, new MapSqlParameterSource());
    }
    update(
        """
        INSERT INTO home.realms
          (realm_id, string_id, name, plan_type, webathena_enabled, web_public_access_enabled,
           bot_creation_policy)
        VALUES (10, 'zephyr', 'Zephyr', 'LIMITED', TRUE, TRUE, 'LIMIT_GENERIC_BOTS')
        """);
    update(
        """
        INSERT INTO home.user_profiles
          (user_id, realm_id, full_name, role, is_billing_admin, is_active, is_bot)
        VALUES (42, 10, 'Iago', 'OWNER', FALSE, TRUE, FALSE),
               (43, 10, 'Hamlet', 'MEMBER', FALSE, FALSE, FALSE),
               (44, 10, 'Welcome Bot', 'MEMBER', FALSE, TRUE, TRUE)
        """);
  }

  @Test
  void realmAndProfilesAreReadBack() {
    final Optional<Realm> realm = realmRepository.findByStringId("zephyr");

    assertThat(realm).contains(
        new Realm(10L, "zephyr", "Zephyr", PlanType.LIMITED, true, true,
            BotCreationPolicy.LIMIT_GENERIC_BOTS));
    assertThat(realmRepository.findById(99L)).isEmpty();
    assertThat(userProfileRepository.findActiveByUserId(42L))
        .hasValueSatisfying(profile -> assertThat(profile.role()).isEqualTo(UserRole.OWNER));
    assertThat(userProfileRepository.findActiveByUserId(43L)).isEmpty();
    assertThat(userProfileRepository.countActiveHumans(10L)).isEqualTo(1L);
  }

  @Test
  void maxMessageIdForNarrowedStream() {
    update(
        """
        INSERT INTO home.streams (stream_id, realm_id, name, recipient_id, deactivated)
        VALUES (3, 10, 'Denmark', 30, FALSE), (4, 10, 'Archive', 40, TRUE),
               (5, 10, 'Empty', 50, FALSE)
        """);
    update(
        """
        INSERT INTO home.messages (message_id, recipient_id, sender_id, sent_at)
        VALUES (5, 30, 42, NOW()), (9, 30, 42, NOW()), (3, 30, 42, NOW()), (12, 40, 42, NOW())
        """);

    assertThat(streamRepository.findByRealmAndName(10L, "denmark"))
        .hasValueSatisfying(stream -> assertThat(stream.recipientId()).isEqualTo(30L));
    assertThat(streamRepository.findByRealmAndName(10L, "Archive")).isEmpty();
    assertThat(messageRepository.findMaxMessageIdByRecipient(30L)).hasValue(9L);
    assertThat(messageRepository.findMaxMessageIdByRecipient(50L)).isEmpty();
  }

  @Test
  void latestUpdateMessageFlagActivityIgnoresOtherQueries() {
    final Instant older = Instant.parse("2026-02-20T00:00:00Z");
    final Instant newer = Instant.parse("2026-02-26T00:00:00Z");
    final Instant unrelated = Instant.parse("2026-03-01T00:00:00Z");
    insertActivity("website", "update_message_flags", older);
    insertActivity("website", "update_message_flags_for_narrow", newer);
    insertActivity("website", "get_messages", unrelated);

    final Optional<UserActivityRecord> activity =
        userActivityRepository.findLatestUpdateMessageFlagActivity(42L);

    assertThat(activity).hasValueSatisfying(found -> {
      assertThat(found.query()).isEqualTo("update_message_flags_for_narrow");
      assertThat(found.lastVisit()).isEqualTo(newer);
    });
    assertThat(userActivityRepository.findLatestUpdateMessageFlagActivity(43L)).isEmpty();
  }

  @Test
  void billingAndTwoFactorLookups() {
    update("INSERT INTO home.billing_customers (customer_id, realm_id) VALUES (7, 10)");
    update(
        """
        INSERT INTO home.customer_plans (plan_id, customer_id, tier, status)
        VALUES (70, 7, 'STANDARD', 'ACTIVE')
        """);
    update(
        """
        INSERT INTO home.two_factor_devices (device_id, user_id, name, confirmed)
        VALUES (1, 42, 'default', TRUE), (2, 43, 'default', FALSE)
        """);
    update(
        """
        INSERT INTO home.preregistration_invites (invite_id, referred_by, email, invited_at)
        VALUES (1, 42, 'a@example.test', NOW()), (2, 42, 'b@example.test', NOW())
        """);

    assertThat(billingCustomerRepository.findByRealmId(10L))
        .hasValueSatisfying(customer -> assertThat(customer.sponsorshipPending()).isFalse());
    assertThat(customerPlanRepository.existsByCustomerId(7L)).isTrue();
    assertThat(customerPlanRepository.existsByCustomerId(8L)).isFalse();
    assertThat(twoFactorDeviceRepository.findDefaultDevice(42L)).isPresent();
    assertThat(twoFactorDeviceRepository.findDefaultDevice(43L)).isEmpty();
    assertThat(preregistrationInviteRepository.countByReferrer(42L)).isEqualTo(2L);
    assertThat(preregistrationInviteRepository.countByReferrer(43L)).isZero();
  }

  private void insertActivity(String client, String query, Instant lastVisit) {
    jdbcTemplate.update(
        """
        INSERT INTO home.user_activity (user_id, client, query, count, last_visit)
        VALUES (42, :client, :query, 1, :lastVisit)
        """,
        new MapSqlParameterSource()
            .addValue("client", client)
            .addValue("query", query)
            .addValue("lastVisit", JdbcTimestampUtils.toTimestamp(lastVisit)));
  }

  private void update(String sql) {
    jdbcTemplate.update(sql, new MapSqlParameterSource());
  }
}
