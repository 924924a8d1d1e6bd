package com.example.home_view.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.home_view.HomeViewFixtures;
import org.junit.jupiter.api.Test;

class DesktopAppPolicyTest {

  private final DesktopAppPolicy policy = new DesktopAppPolicy(HomeViewFixtures.properties());

  @Test
  void oldDesktopAppIsInsecure() {
    assertThat(policy.isInsecure("Mozilla/5.0 ZulipElectron/5.1.9 Chrome/120")).isTrue();
    assertThat(policy.isInsecure("ZulipElectron/4.0")).isTrue();
  }

  @Test
  void currentDesktopAppAndBrowsersAreSecure() {
    assertThat(policy.isInsecure("Mozilla/5.0 ZulipElectron/5.2.0 Chrome/120")).isFalse();
    assertThat(policy.isInsecure("Mozilla/5.0 ZulipElectron/5.10.1")).isFalse();
    assertThat(policy.isInsecure("Mozilla/5.0 Firefox/128.0")).isFalse();
    assertThat(policy.isInsecure(null)).isFalse();
  }

  @Test
  void unparseableVersionIsNotFlagged() {
    assertThat(policy.isInsecure("Mozilla ZulipElectron/5.99999999999.0")).isFalse();
    assertThat(policy.isInsecure("ZulipElectron/99999999999")).isFalse();
    assertThat(policy.isInsecure("ZulipElectron/5..1")).isFalse();
  }

  @Test
  void compareVersionsPadsMissingParts() {
    assertThat(DesktopAppPolicy.compareVersions("5.2", "5.2.0")).isZero();
    assertThat(DesktopAppPolicy.compareVersions("10.0.0", "9.9.9")).isPositive();
  }
}
