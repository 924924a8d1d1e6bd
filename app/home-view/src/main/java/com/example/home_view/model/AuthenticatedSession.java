package com.example.home_view.model;

import java.util.Optional;

public record AuthenticatedSession(Identity user, String clientName) implements HomeSession {

  public AuthenticatedSession {
    if (user == null) {
      throw new IllegalArgumentException("user is required");
    }
    clientName = clientName == null || clientName.isBlank() ? "website" : clientName;
  }

  @Override
  public Optional<Identity> identity() {
    return Optional.of(user);
  }
}
