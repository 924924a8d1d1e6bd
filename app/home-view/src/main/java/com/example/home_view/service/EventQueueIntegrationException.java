/*
 * どこで: home-view サービス層
 * 何を: event queue 下流呼び出し失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.home_view.service;

public class EventQueueIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_REQUEST,
    UNAUTHORIZED,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public EventQueueIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EventQueueIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
