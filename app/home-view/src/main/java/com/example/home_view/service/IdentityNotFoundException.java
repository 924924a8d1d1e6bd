package com.example.home_view.service;

/** 認証済みヘッダーのユーザー ID に対応する有効なユーザーがいない。 */
public class IdentityNotFoundException extends RuntimeException {

  public IdentityNotFoundException(String message) {
    super(message);
  }
}
