package com.example.ip_provisioner.service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** 役割: 生成する成果物向けに値を PostgreSQL リテラルへ変換する。 */
final class SqlLiterals {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS'+00'").withZone(ZoneOffset.UTC);

  private SqlLiterals() {}

  static String string(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  static String timestamp(Instant instant) {
    if (instant == null) {
      return "NULL";
    }
    return "'" + TIMESTAMP_FORMAT.format(instant) + "'";
  }

  static String bool(boolean value) {
    return value ? "TRUE" : "FALSE";
  }
}
