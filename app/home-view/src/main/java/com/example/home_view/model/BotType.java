/*
 * どこで: home-view モデル
 * 何を: 作成可能な bot 種別のカタログ
 * なぜ: type_id と表示名をクライアント契約として固定するため
 */
package com.example.home_view.model;

public enum BotType {
  DEFAULT_BOT(1, "Generic bot"),
  INCOMING_WEBHOOK_BOT(2, "Incoming webhook"),
  OUTGOING_WEBHOOK_BOT(3, "Outgoing webhook"),
  EMBEDDED_BOT(4, "Embedded bot");

  private final int typeId;
  private final String displayName;

  BotType(int typeId, String displayName) {
    this.typeId = typeId;
    this.displayName = displayName;
  }

  public int typeId() {
    return typeId;
  }

  public String displayName() {
    return displayName;
  }
}
