package com.example.home_view.service;

public class SpectatorAccessDeniedException extends RuntimeException {

  public SpectatorAccessDeniedException(String message) {
    super(message);
  }
}
