package com.example.home_view.service;

public class RealmNotFoundException extends RuntimeException {

  public RealmNotFoundException(String message) {
    super(message);
  }
}
