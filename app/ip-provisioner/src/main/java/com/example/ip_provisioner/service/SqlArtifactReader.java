/*
 * どこで: プロビジョニングのサービス層
 * 何を: プロビジョニングスクリプトやバックアップのヘッダと文を読み取る
 * なぜ: プロビジョニングとロールバックで同じロード経路を使うため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ArtifactHeader;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 動作: 文は遅延して読む。トリム後に {@code ;} で終わる最初の行で 1 文が終わる。
 * コメント行として扱うのは先頭のヘッダブロックだけ。
 */
public final class SqlArtifactReader implements Closeable {

  private final Path path;
  private final BufferedReader reader;
  private final Map<String, String> headerFields;
  private String pendingLine;

  private SqlArtifactReader(Path path, BufferedReader reader) throws IOException {
    this.path = path;
    this.reader = reader;
    this.headerFields = readHeaderFields();
  }

  public static SqlArtifactReader open(Path path) throws IOException {
    final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    try {
      return new SqlArtifactReader(path, reader);
    } catch (IOException | RuntimeException ex) {
      reader.close();
      throw ex;
    }
  }

  public Path path() {
    return path;
  }

  /**
   * @throws IllegalArgumentException ヘッダブロックがあるが不完全な場合
   */
  public Optional<ArtifactHeader> header() {
    if (headerFields.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(ArtifactHeader.fromFields(headerFields));
  }

  /** 役割: 終端のセミコロンを含む次の文を返し、末尾なら empty を返す。 */
  public Optional<String> nextStatement() throws IOException {
    final StringBuilder statement = new StringBuilder();
    String line = pendingLine != null ? pendingLine : reader.readLine();
    pendingLine = null;
    while (line != null) {
      final String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        if (statement.length() > 0) {
          statement.append('\n');
        }
        statement.append(trimmed);
        if (trimmed.endsWith(";")) {
          return Optional.of(statement.toString());
        }
      }
      line = reader.readLine();
    }
    if (statement.length() > 0) {
      throw new IOException("artifact " + path + " ends with an unterminated statement");
    }
    return Optional.empty();
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  private Map<String, String> readHeaderFields() throws IOException {
    final Map<String, String> fields = new LinkedHashMap<>();
    String line;
    while ((line = reader.readLine()) != null) {
      final String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (!trimmed.startsWith(ArtifactHeader.COMMENT_PREFIX)) {
        pendingLine = line;
        break;
      }
      final String body = trimmed.substring(ArtifactHeader.COMMENT_PREFIX.length()).trim();
      final int colon = body.indexOf(':');
      if (colon > 0) {
        fields.put(body.substring(0, colon).trim(), body.substring(colon + 1).trim());
      }
    }
    return fields;
  }
}
