/*
 * どこで: home-view モデル
 * 何を: 認証済みユーザーを snapshot 計算用に固めたもの
 * なぜ: 1 回の snapshot 構築中に値が変わらないことを型で保証するため
 */
package com.example.home_view.model;

import java.util.Set;

public record Identity(
    long userId,
    String fullName,
    Realm realm,
    ColorScheme colorScheme,
    boolean guest,
    boolean realmAdmin,
    boolean realmOwner,
    boolean billingAccess,
    Set<BotType> allowedBotTypes,
    String defaultLanguage,
    TutorialStatus tutorialStatus) {

  public Identity {
    if (realm == null) {
      throw new IllegalArgumentException("realm is required");
    }
    colorScheme = colorScheme == null ? ColorScheme.AUTOMATIC : colorScheme;
    allowedBotTypes = allowedBotTypes == null ? Set.of() : Set.copyOf(allowedBotTypes);
    tutorialStatus = tutorialStatus == null ? TutorialStatus.FINISHED : tutorialStatus;
  }
}
