package com.example.home_view.model;

public enum UserRole {
  OWNER,
  ADMINISTRATOR,
  MODERATOR,
  MEMBER,
  GUEST;

  public boolean isRealmAdmin() {
    return this == OWNER || this == ADMINISTRATOR;
  }
}
