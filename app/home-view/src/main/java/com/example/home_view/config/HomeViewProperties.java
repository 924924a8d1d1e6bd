/*
 * どこで: home-view 設定
 * 何を: サーバー全体のフラグと page_params へそのまま渡す設定値を保持する
 * なぜ: グローバル設定を明示的な引数として assembler へ渡すため
 */
package com.example.home_view.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "home")
public record HomeViewProperties(
    boolean testSuite,
    String homeNotLoggedIn,
    boolean warnNoEmail,
    boolean searchPillsEnabled,
    boolean corporateEnabled,
    boolean promoteSponsoringZulip,
    boolean twoFactorAuthenticationEnabled,
    boolean embeddedBotsEnabled,
    String appsPageUrl,
    String rootDomain,
    @Pattern(regexp = "[0-9]{1,9}(\\.[0-9]{1,9})*") String minSecureDesktopVersion) {

  public HomeViewProperties {
    homeNotLoggedIn =
        homeNotLoggedIn == null || homeNotLoggedIn.isBlank() ? "/login/" : homeNotLoggedIn;
    appsPageUrl =
        appsPageUrl == null || appsPageUrl.isBlank() ? "https://zulip.com/apps/" : appsPageUrl;
    rootDomain = rootDomain == null || rootDomain.isBlank() ? "localhost" : rootDomain;
    minSecureDesktopVersion =
        minSecureDesktopVersion == null || minSecureDesktopVersion.isBlank()
            ? "5.2.0"
            : minSecureDesktopVersion;
  }
}
