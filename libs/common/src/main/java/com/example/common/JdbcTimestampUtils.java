/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC Timestamp と Instant / epoch 秒を相互変換する
 * なぜ: リポジトリとサービスで UTC 変換の書き方を揃えるため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC を表現するため Timestamp.from でそのまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 秒未満は切り捨てる
  public static long toEpochSeconds(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("instant is required");
    }
    return instant.getEpochSecond();
  }
}
