/*
 * どこで: home-view モデル
 * 何を: event queue 登録時に宣言するクライアント機能
 * なぜ: ホーム画面ロード時の宣言内容を 1 か所に固定するため
 */
package com.example.home_view.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClientCapabilities(
    boolean notificationSettingsNull,
    boolean bulkMessageDeletion,
    boolean userAvatarUrlFieldOptional,
    boolean streamTypingNotifications,
    boolean userSettingsObject) {

  // stream_typing_notifications はフロントエンド対応後に true へ切り替える
  public static final ClientCapabilities HOME_PAGE =
      new ClientCapabilities(true, true, true, false, true);
}
