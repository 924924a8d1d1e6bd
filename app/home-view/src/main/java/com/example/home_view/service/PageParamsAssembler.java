/*
 * どこで: home-view サービス層
 * 何を: ホーム画面ロード時の初期状態 snapshot (page_params) を組み立てる
 * なぜ: 各サブシステムの値を 1 度だけ計算し、決められた順序で 1 つの応答へマージするため
 */
package com.example.home_view.service;

import com.example.home_view.config.HomeViewProperties;
import com.example.home_view.model.AuthenticatedSession;
import com.example.home_view.model.BillingInfo;
import com.example.home_view.model.ClientCapabilities;
import com.example.home_view.model.DisplayOptions;
import com.example.home_view.model.EventQueueRegistration;
import com.example.home_view.model.HomeSession;
import com.example.home_view.model.Identity;
import com.example.home_view.model.PageParams;
import com.example.home_view.model.PlanType;
import com.example.home_view.model.Realm;
import com.example.home_view.model.UserPermissionInfo;
import com.example.home_view.repository.TwoFactorDeviceRepository;
import com.example.home_view.service.dto.InitialStateFetchRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PageParamsAssembler {

  static final String DEPENDENCY_EVENT_QUEUE = "event_queue";

  private static final EventQueueClient.RegisterOptions HOME_PAGE_REGISTER_OPTIONS =
      new EventQueueClient.RegisterOptions(true, true, true, false);

  private final HomeViewProperties properties;
  private final EventQueueClient eventQueueClient;
  private final InitialStatePostProcessor initialStatePostProcessor;
  private final LocalizationService localizationService;
  private final ReadStateResolver readStateResolver;
  private final BillingPolicy billingPolicy;
  private final PermissionProjector permissionProjector;
  private final BotTypeCatalog botTypeCatalog;
  private final NarrowOverride narrowOverride;
  private final TwoFactorDeviceRepository twoFactorDeviceRepository;
  private final HomeViewMetrics metrics;

  public PageParams build(HomeSession session, Realm realm, DisplayOptions options) {
    if (session == null) {
      throw new IllegalArgumentException("session is required");
    }
    if (realm == null) {
      throw new IllegalArgumentException("realm is required");
    }
    final DisplayOptions display = options == null ? DisplayOptions.plain() : options;
    final ClientCapabilities capabilities = ClientCapabilities.HOME_PAGE;

    final Identity identity;
    final EventQueueRegistration registration;
    final String defaultLanguage;
    if (session instanceof AuthenticatedSession authenticated) {
      if (authenticated.user().realm().realmId() != realm.realmId()) {
        throw new IllegalStateException("identity does not belong to the requested realm");
      }
      identity = authenticated.user();
      registration =
          timed(
              () ->
                  eventQueueClient.register(
                      authenticated.user(),
                      authenticated.clientName(),
                      capabilities,
                      display.narrow(),
                      HOME_PAGE_REGISTER_OPTIONS));
      defaultLanguage = requireDefaultLanguage(registration.state());
    } else {
      identity = null;
      registration = fetchSpectatorState(realm, capabilities);
      defaultLanguage = requireDefaultLanguage(registration.state());
    }

    final String language =
        localizationService.resolveRequestLanguage(display.pathLanguage(), defaultLanguage);
    final Double furthestReadTime = readStateResolver.furthestReadTime(identity);
    final BillingInfo billing = billingPolicy.evaluate(identity, properties.corporateEnabled());
    final UserPermissionInfo permissionInfo = permissionProjector.project(identity, realm);
    final boolean promoteSponsoring =
        properties.promoteSponsoringZulip()
            && (realm.planType() == PlanType.STANDARD_FREE
                || realm.planType() == PlanType.SELF_HOSTED);
    final boolean twoFactorEnabled = properties.twoFactorAuthenticationEnabled() && identity != null;
    // デバイス参照は 2FA が有効なときだけ行う
    final boolean twoFactorEnabledUser =
        twoFactorEnabled && twoFactorDeviceRepository.findDefaultDevice(identity.userId()).isPresent();

    final Map<String, Object> pageParams = new LinkedHashMap<>();
    pageParams.put("test_suite", properties.testSuite());
    pageParams.put("insecure_desktop_app", display.insecureDesktopApp());
    pageParams.put("login_page", properties.homeNotLoggedIn());
    pageParams.put("warn_no_email", properties.warnNoEmail());
    pageParams.put("search_pills_enabled", properties.searchPillsEnabled());
    pageParams.put("corporate_enabled", properties.corporateEnabled());

    pageParams.put("language_list", localizationService.listLanguages());
    pageParams.put("needs_tutorial", display.needsTutorial());
    pageParams.put("first_in_realm", display.firstInRealm());
    pageParams.put("prompt_for_invites", display.promptForInvites());
    pageParams.put("furthest_read_time", furthestReadTime);
    pageParams.put("bot_types", botTypeCatalog.describe(identity));
    pageParams.put("two_fa_enabled", twoFactorEnabled);
    pageParams.put("apps_page_url", properties.appsPageUrl());
    pageParams.put("show_billing", billing.showBilling());
    pageParams.put("promote_sponsoring_zulip", promoteSponsoring);
    pageParams.put("show_plans", billing.showPlans());
    pageParams.put("show_webathena", permissionInfo.showWebathena());
    pageParams.put("two_fa_enabled_user", twoFactorEnabledUser);
    pageParams.put("is_spectator", identity == null);
    pageParams.put("no_event_queue", registration.queueId() == null);

    pageParams.putAll(registration.state());

    narrowOverride.apply(
        pageParams, display.narrowStream(), display.narrowTopic(), display.narrow());

    pageParams.put("translation_data", localizationService.translationData(language));
    return new PageParams(registration.queueId(), pageParams, permissionInfo);
  }

  private EventQueueRegistration fetchSpectatorState(Realm realm, ClientCapabilities capabilities) {
    final InitialStateFetchRequest request =
        new InitialStateFetchRequest(
            false,
            capabilities.userAvatarUrlFieldOptional(),
            capabilities.userSettingsObject(),
            false,
            false,
            false);
    final Map<String, Object> state =
        timed(() -> eventQueueClient.fetchInitialState(realm, request));
    initialStatePostProcessor.postProcess(null, state, false);
    return new EventQueueRegistration(null, state);
  }

  private String requireDefaultLanguage(Map<String, Object> state) {
    if (state.get("user_settings") instanceof Map<?, ?> userSettings
        && userSettings.get("default_language") instanceof String language
        && !language.isBlank()) {
      return language;
    }
    throw new IllegalStateException("initial state is missing user_settings.default_language");
  }

  private <T> T timed(Supplier<T> call) {
    final long startedAt = System.nanoTime();
    try {
      final T result = call.get();
      metrics.recordDependencyDuration(
          DEPENDENCY_EVENT_QUEUE, "success", Duration.ofNanos(System.nanoTime() - startedAt));
      return result;
    } catch (EventQueueIntegrationException ex) {
      metrics.recordDependencyDuration(
          DEPENDENCY_EVENT_QUEUE, "error", Duration.ofNanos(System.nanoTime() - startedAt));
      metrics.recordDependencyError(DEPENDENCY_EVENT_QUEUE, ex.reason().name().toLowerCase(Locale.ROOT));
      throw ex;
    }
  }
}
