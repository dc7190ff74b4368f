/*
 * どこで: プロビジョニングのドメインモデル
 * 何を: プロビジョニングスクリプトとバックアップの先頭コメントブロックを表す
 * なぜ: 再生時に対象リージョンを先にロックできるよう、成果物がリージョンを名乗るため
 */
package com.example.ip_provisioner.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

public record ArtifactHeader(ArtifactKind kind, String region, Instant capturedAt, long recordCount) {

  public static final String COMMENT_PREFIX = "--";
  static final String TITLE = "ip-provisioner artifact";
  static final String KIND = "Kind";
  static final String REGION = "Region";
  static final String CAPTURED_AT = "Captured-At";
  static final String RECORD_COUNT = "Record-Count";

  public List<String> toCommentLines() {
    return List.of(
        COMMENT_PREFIX + " " + TITLE,
        COMMENT_PREFIX + " " + KIND + ": " + kind.name(),
        COMMENT_PREFIX + " " + REGION + ": " + region,
        COMMENT_PREFIX + " " + CAPTURED_AT + ": " + capturedAt,
        COMMENT_PREFIX + " " + RECORD_COUNT + ": " + recordCount);
  }

  /**
   * 役割: 先頭コメントブロックから読んだ {@code Key: value} の組からヘッダを組み立てる。
   *
   * @throws IllegalArgumentException 項目の欠落または形式不正の場合
   */
  public static ArtifactHeader fromFields(Map<String, String> fields) {
    final String kind = required(fields, KIND);
    final String region = required(fields, REGION);
    final String capturedAt = required(fields, CAPTURED_AT);
    final String recordCount = required(fields, RECORD_COUNT);
    try {
      return new ArtifactHeader(
          ArtifactKind.valueOf(kind),
          region,
          Instant.parse(capturedAt),
          Long.parseLong(recordCount));
    } catch (DateTimeParseException | IllegalArgumentException ex) {
      throw new IllegalArgumentException("malformed artifact header: " + fields, ex);
    }
  }

  private static String required(Map<String, String> fields, String key) {
    final String value = fields.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("artifact header is missing " + key);
    }
    return value;
  }
}
