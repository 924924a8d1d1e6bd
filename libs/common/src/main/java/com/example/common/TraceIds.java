package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newRequestId();
    }
    return candidate.trim();
  }
}
