package com.example.home_view.service;

import com.example.home_view.config.HomeViewProperties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/** 既知の脆弱性がある古いデスクトップアプリを User-Agent から判定する。 */
@Component
@RequiredArgsConstructor
public class DesktopAppPolicy {

  private static final Pattern DESKTOP_VERSION = Pattern.compile("ZulipElectron/([0-9.]+)");
  // 各要素を int に収まる桁数へ制限する
  private static final Pattern COMPARABLE_VERSION = Pattern.compile("[0-9]{1,9}(\\.[0-9]{1,9})*");

  private final HomeViewProperties properties;

  public boolean isInsecure(@Nullable String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return false;
    }
    final Matcher matcher = DESKTOP_VERSION.matcher(userAgent);
    if (!matcher.find()) {
      return false;
    }
    final String version = matcher.group(1);
    if (!COMPARABLE_VERSION.matcher(version).matches()) {
      return false;
    }
    return compareVersions(version, properties.minSecureDesktopVersion()) < 0;
  }

  static int compareVersions(String left, String right) {
    final String[] leftParts = left.split("\\.");
    final String[] rightParts = right.split("\\.");
    final int length = Math.max(leftParts.length, rightParts.length);
    for (int i = 0; i < length; i++) {
      final int compared = Integer.compare(part(leftParts, i), part(rightParts, i));
      if (compared != 0) {
        return compared;
      }
    }
    return 0;
  }

  private static int part(String[] parts, int index) {
    if (index >= parts.length || parts[index].isEmpty()) {
      return 0;
    }
    return Integer.parseInt(parts[index]);
  }
}
