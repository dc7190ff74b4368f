/*
 * どこで: 共通 JDBC ヘルパー
 * 何を: timestamptz 列向けに Instant と java.sql.Timestamp を相互変換する
 * なぜ: PostgreSQL ドライバは Instant パラメータの SQL 型を推論できないため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
