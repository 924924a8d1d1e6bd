package com.example.home_view.model;

public enum BotCreationPolicy {
  EVERYONE,
  LIMIT_GENERIC_BOTS,
  ADMINS_ONLY
}
