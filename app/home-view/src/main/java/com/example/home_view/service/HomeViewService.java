/*
 * どこで: home-view サービス層
 * 何を: HTTP リクエストからセッション種別・realm・絞り込み対象・表示オプションを決めて snapshot を作る
 * なぜ: assembler を 1 回だけ呼び、リクエスト解釈を assembler から切り離すため
 */
package com.example.home_view.service;

import com.example.home_view.config.HomeViewProperties;
import com.example.home_view.model.DisplayOptions;
import com.example.home_view.model.HomeSession;
import com.example.home_view.model.Identity;
import com.example.home_view.model.NarrowTerm;
import com.example.home_view.model.PageParams;
import com.example.home_view.model.Realm;
import com.example.home_view.model.StreamRecord;
import com.example.home_view.model.TutorialStatus;
import com.example.home_view.repository.PreregistrationInviteRepository;
import com.example.home_view.repository.RealmRepository;
import com.example.home_view.repository.StreamRepository;
import com.example.home_view.repository.UserProfileRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HomeViewService {

  private static final Logger logger = LoggerFactory.getLogger(HomeViewService.class);
  static final String CLIENT_NAME = "website";

  private final HomeViewProperties properties;
  private final IdentityResolver identityResolver;
  private final RealmRepository realmRepository;
  private final StreamRepository streamRepository;
  private final UserProfileRepository userProfileRepository;
  private final PreregistrationInviteRepository preregistrationInviteRepository;
  private final LocalizationService localizationService;
  private final DesktopAppPolicy desktopAppPolicy;
  private final PageParamsAssembler pageParamsAssembler;
  private final HomeViewMetrics metrics;

  public PageParams load(HomeViewRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request is required");
    }
    final String sessionKind = request.userId() == null ? "spectator" : "authenticated";
    try {
      final PageParams pageParams = doLoad(request);
      metrics.recordPageParamsResult(sessionKind, "success");
      return pageParams;
    } catch (RuntimeException ex) {
      metrics.recordPageParamsResult(sessionKind, "error");
      throw ex;
    }
  }

  private PageParams doLoad(HomeViewRequest request) {
    final Identity identity;
    final Realm realm;
    final HomeSession session;
    if (request.userId() != null) {
      identity = identityResolver.resolve(request.userId());
      realm = identity.realm();
      session = HomeSession.authenticated(identity, CLIENT_NAME);
    } else {
      identity = null;
      realm = resolveSpectatorRealm(request.host());
      session = HomeSession.spectator();
    }

    final StreamRecord narrowStream = resolveNarrowStream(realm, request.stream());
    final String narrowTopic = narrowStream == null ? null : blankToNull(request.topic());
    final boolean firstInRealm =
        identity != null && userProfileRepository.countActiveHumans(realm.realmId()) == 1;
    final boolean promptForInvites =
        firstInRealm && preregistrationInviteRepository.countByReferrer(identity.userId()) == 0;
    final DisplayOptions options =
        new DisplayOptions(
            desktopAppPolicy.isInsecure(request.userAgent()),
            narrowTerms(narrowStream, narrowTopic),
            narrowStream,
            narrowTopic,
            firstInRealm,
            promptForInvites,
            identity != null && identity.tutorialStatus() == TutorialStatus.WAITING,
            localizationService.languageFromPath(request.path()));
    logger.debug(
        "building page params realm={} session={} narrowed={}",
        realm.stringId(),
        identity == null ? "spectator" : "authenticated",
        narrowStream != null);
    return pageParamsAssembler.build(session, realm, options);
  }

  private Realm resolveSpectatorRealm(@Nullable String host) {
    final String subdomain = subdomainOf(host);
    final Realm realm =
        realmRepository
            .findByStringId(subdomain)
            .orElseThrow(() -> new RealmNotFoundException("realm not found for host: " + host));
    if (!realm.webPublicAccessEnabled()) {
      throw new SpectatorAccessDeniedException("realm does not allow spectators: " + realm.stringId());
    }
    return realm;
  }

  // ルートドメイン直下のアクセスは string_id が空の realm を指す
  String subdomainOf(@Nullable String host) {
    if (host == null || host.isBlank()) {
      return "";
    }
    String normalized = host.trim().toLowerCase(Locale.ROOT);
    final int portIndex = normalized.indexOf(':');
    if (portIndex >= 0) {
      normalized = normalized.substring(0, portIndex);
    }
    final String rootDomain = properties.rootDomain().toLowerCase(Locale.ROOT);
    if (normalized.equals(rootDomain)) {
      return "";
    }
    if (normalized.endsWith("." + rootDomain)) {
      return normalized.substring(0, normalized.length() - rootDomain.length() - 1);
    }
    return normalized;
  }

  @Nullable
  private StreamRecord resolveNarrowStream(Realm realm, @Nullable String streamName) {
    if (streamName == null || streamName.isBlank()) {
      return null;
    }
    return streamRepository.findByRealmAndName(realm.realmId(), streamName.trim()).orElse(null);
  }

  private List<NarrowTerm> narrowTerms(@Nullable StreamRecord stream, @Nullable String topic) {
    final List<NarrowTerm> terms = new ArrayList<>();
    if (stream == null) {
      return terms;
    }
    terms.add(new NarrowTerm("stream", stream.name()));
    if (topic != null) {
      terms.add(new NarrowTerm("topic", topic));
    }
    return terms;
  }

  @Nullable
  private String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
