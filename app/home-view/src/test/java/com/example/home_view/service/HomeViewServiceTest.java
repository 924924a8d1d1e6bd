package com.example.home_view.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.home_view.HomeViewFixtures;
import com.example.home_view.config.LocalizationProperties;
import com.example.home_view.model.AuthenticatedSession;
import com.example.home_view.model.BotCreationPolicy;
import com.example.home_view.model.BotType;
import com.example.home_view.model.ColorScheme;
import com.example.home_view.model.DisplayOptions;
import com.example.home_view.model.HomeSession;
import com.example.home_view.model.Identity;
import com.example.home_view.model.NarrowTerm;
import com.example.home_view.model.PageParams;
import com.example.home_view.model.PlanType;
import com.example.home_view.model.Realm;
import com.example.home_view.model.StreamRecord;
import com.example.home_view.model.TutorialStatus;
import com.example.home_view.model.UserPermissionInfo;
import com.example.home_view.repository.PreregistrationInviteRepository;
import com.example.home_view.repository.RealmRepository;
import com.example.home_view.repository.StreamRepository;
import com.example.home_view.repository.UserProfileRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HomeViewServiceTest {

  private static final PageParams RESULT =
      new PageParams(null, Map.of("is_spectator", true), UserPermissionInfo.ANONYMOUS);

  private final IdentityResolver identityResolver = mock(IdentityResolver.class);
  private final RealmRepository realmRepository = mock(RealmRepository.class);
  private final StreamRepository streamRepository = mock(StreamRepository.class);
  private final UserProfileRepository userProfileRepository = mock(UserProfileRepository.class);
  private final PreregistrationInviteRepository preregistrationInviteRepository =
      mock(PreregistrationInviteRepository.class);
  private final PageParamsAssembler pageParamsAssembler = mock(PageParamsAssembler.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final HomeViewService service =
      new HomeViewService(
          HomeViewFixtures.properties(),
          identityResolver,
          realmRepository,
          streamRepository,
          userProfileRepository,
          preregistrationInviteRepository,
          new LocalizationService(
              new LocalizationProperties(
                  "en",
                  List.of(
                      new LocalizationProperties.Language("en", "English", "en", 100),
                      new LocalizationProperties.Language("de", "Deutsch", "de", 92))),
              new ObjectMapper()),
          new DesktopAppPolicy(HomeViewFixtures.properties()),
          pageParamsAssembler,
          new HomeViewMetrics(meterRegistry));

  @Test
  void spectatorRealmComesFromHostSubdomain() {
    final Realm realm = HomeViewFixtures.realm(PlanType.LIMITED);
    when(realmRepository.findByStringId("zephyr")).thenReturn(Optional.of(realm));
    when(pageParamsAssembler.build(any(), any(), any())).thenReturn(RESULT);

    final PageParams result =
        service.load(
            new HomeViewRequest(
                null, "zephyr.example.test:443", "/v1/home/page-params", null, null, null));

    assertThat(result).isSameAs(RESULT);
    verify(pageParamsAssembler).build(HomeSession.spectator(), realm, DisplayOptions.plain());
    verify(userProfileRepository, never()).countActiveHumans(anyLong());
    assertThat(
            meterRegistry
                .get("home.page_params.total")
                .tags("session", "spectator", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void unknownRealmIsRejected() {
    when(realmRepository.findByStringId("nowhere")).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.load(
                    new HomeViewRequest(null, "nowhere.example.test", "/v1/home", null, null, null)))
        .isInstanceOf(RealmNotFoundException.class);
    assertThat(
            meterRegistry
                .get("home.page_params.total")
                .tags("session", "spectator", "result", "error")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void realmWithoutWebPublicAccessRejectsSpectators() {
    final Realm closed =
        new Realm(10L, "zephyr", "Zephyr", PlanType.STANDARD, false, false, BotCreationPolicy.EVERYONE);
    when(realmRepository.findByStringId("zephyr")).thenReturn(Optional.of(closed));

    assertThatThrownBy(
            () ->
                service.load(
                    new HomeViewRequest(null, "zephyr.example.test", "/v1/home", null, null, null)))
        .isInstanceOf(SpectatorAccessDeniedException.class);
    verify(pageParamsAssembler, never()).build(any(), any(), any());
  }

  @Test
  void authenticatedLoadBuildsDisplayOptions() {
    final Realm realm = HomeViewFixtures.realm(PlanType.STANDARD);
    final Identity newcomer =
        new Identity(
            42L,
            "Iago",
            realm,
            ColorScheme.LIGHT,
            false,
            true,
            true,
            true,
            Set.of(BotType.DEFAULT_BOT),
            "en",
            TutorialStatus.WAITING);
    final StreamRecord denmark = new StreamRecord(3L, realm.realmId(), "Denmark", 30L);
    when(identityResolver.resolve(42L)).thenReturn(newcomer);
    when(streamRepository.findByRealmAndName(realm.realmId(), "Denmark"))
        .thenReturn(Optional.of(denmark));
    when(userProfileRepository.countActiveHumans(realm.realmId())).thenReturn(1L);
    when(preregistrationInviteRepository.countByReferrer(42L)).thenReturn(0L);
    when(pageParamsAssembler.build(any(), any(), any())).thenReturn(RESULT);

    service.load(
        new HomeViewRequest(
            42L,
            "zephyr.example.test",
            "/de/v1/home/page-params",
            "Mozilla/5.0 ZulipElectron/5.0.0",
            " Denmark ",
            "lunch"));

    final ArgumentCaptor<HomeSession> session = ArgumentCaptor.forClass(HomeSession.class);
    final ArgumentCaptor<DisplayOptions> options = ArgumentCaptor.forClass(DisplayOptions.class);
    verify(pageParamsAssembler).build(session.capture(), eq(realm), options.capture());
    assertThat(session.getValue()).isEqualTo(new AuthenticatedSession(newcomer, "website"));
    assertThat(options.getValue())
        .isEqualTo(
            new DisplayOptions(
                true,
                List.of(new NarrowTerm("stream", "Denmark"), new NarrowTerm("topic", "lunch")),
                denmark,
                "lunch",
                true,
                true,
                true,
                "de"));
    verify(realmRepository, never()).findByStringId(any());
  }

  @Test
  void unknownStreamMeansNoNarrow() {
    final Realm realm = HomeViewFixtures.realm(PlanType.STANDARD);
    final Identity member = HomeViewFixtures.member(realm);
    when(identityResolver.resolve(42L)).thenReturn(member);
    when(streamRepository.findByRealmAndName(realm.realmId(), "Atlantis"))
        .thenReturn(Optional.empty());
    when(userProfileRepository.countActiveHumans(realm.realmId())).thenReturn(5L);
    when(pageParamsAssembler.build(any(), any(), any())).thenReturn(RESULT);

    service.load(new HomeViewRequest(42L, null, "/v1/home/page-params", null, "Atlantis", "x"));

    final ArgumentCaptor<DisplayOptions> options = ArgumentCaptor.forClass(DisplayOptions.class);
    verify(pageParamsAssembler).build(any(), eq(realm), options.capture());
    assertThat(options.getValue().narrowStream()).isNull();
    assertThat(options.getValue().narrowTopic()).isNull();
    assertThat(options.getValue().narrow()).isEmpty();
    assertThat(options.getValue().promptForInvites()).isFalse();
    verify(preregistrationInviteRepository, never()).countByReferrer(anyLong());
  }

  @Test
  void subdomainOfHandlesRootDomainAndPorts() {
    assertThat(service.subdomainOf("example.test")).isEmpty();
    assertThat(service.subdomainOf("Zephyr.Example.Test:9991")).isEqualTo("zephyr");
    assertThat(service.subdomainOf(null)).isEmpty();
  }
}
