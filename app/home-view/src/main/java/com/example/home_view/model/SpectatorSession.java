package com.example.home_view.model;

import java.util.Optional;

public record SpectatorSession() implements HomeSession {

  static final SpectatorSession INSTANCE = new SpectatorSession();

  @Override
  public Optional<Identity> identity() {
    return Optional.empty();
  }
}
