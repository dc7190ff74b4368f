/*
 * どこで: ip-provisioner 設定バインド
 * 何を: インベントリ DB 環境 1 つ分の接続情報を保持する
 * なぜ: local 環境は固定の認証情報を持ち、その他の環境はシークレット名を持つため
 */
package com.example.ip_provisioner.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record EnvironmentProperties(
    @NotBlank String host,
    @Positive int port,
    @NotBlank String database,
    boolean local,
    String username,
    String password,
    String secretName,
    String awsProfile) {

  public EnvironmentProperties {
    port = port == 0 ? 5432 : port;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ":" + port + "/" + database;
  }
}
