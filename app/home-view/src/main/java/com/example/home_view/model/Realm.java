/*
 * どこで: home-view モデル
 * 何を: realm(テナント) の参照専用レコード
 * なぜ: プラン種別と公開設定を snapshot 計算へ渡すため
 */
package com.example.home_view.model;

public record Realm(
    long realmId,
    String stringId,
    String name,
    PlanType planType,
    boolean webathenaEnabled,
    boolean webPublicAccessEnabled,
    BotCreationPolicy botCreationPolicy) {

  public Realm {
    stringId = stringId == null ? "" : stringId;
    if (planType == null) {
      throw new IllegalArgumentException("planType is required");
    }
    botCreationPolicy = botCreationPolicy == null ? BotCreationPolicy.EVERYONE : botCreationPolicy;
  }
}
