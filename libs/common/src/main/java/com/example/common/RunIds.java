package com.example.common;

import java.util.UUID;

public final class RunIds {
  private static final int SHORT_LENGTH = 8;

  private RunIds() {}

  /** 役割: 1 回の CLI 実行の全ログ行に付与する短いランダム ID を生成する。 */
  public static String newRunId() {
    return UUID.randomUUID().toString().substring(0, SHORT_LENGTH);
  }
}
