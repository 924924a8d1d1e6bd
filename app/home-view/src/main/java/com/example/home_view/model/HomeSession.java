package com.example.home_view.model;

import java.util.Optional;

/**
 * ホーム画面をロードしたセッションの種別。
 *
 * <p>{@link AuthenticatedSession} は event queue を登録し、{@link SpectatorSession} は一度だけ状態を取得する。
 */
public interface HomeSession {

  Optional<Identity> identity();

  static HomeSession authenticated(Identity identity, String clientName) {
    return new AuthenticatedSession(identity, clientName);
  }

  static HomeSession spectator() {
    return SpectatorSession.INSTANCE;
  }
}
