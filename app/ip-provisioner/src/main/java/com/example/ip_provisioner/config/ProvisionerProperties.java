/*
 * どこで: ip-provisioner 設定バインド
 * 何を: レンジ既定値、書き込み戦略の調整値、バックアップ先、環境定義を保持する
 * なぜ: 環境ごとの接続情報をコードに埋め込まず起動時に組み立てるため
 */
package com.example.ip_provisioner.config;

import com.example.ip_provisioner.model.ExecutionMode;
import com.example.ip_provisioner.model.InsertStrategyType;
import com.example.ip_provisioner.service.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "provisioner")
public record ProvisionerProperties(
    @NotBlank String expandedRange,
    @NotBlank String currentRange,
    boolean includeBroadcast,
    @NotNull InsertStrategyType insertStrategy,
    @Positive int batchSize,
    @Positive int progressInterval,
    @NotNull Path backupDir,
    Path tempDir,
    @NotNull ExecutionMode executionMode,
    @NotEmpty Map<String, @Valid EnvironmentProperties> environments) {

  public ProvisionerProperties {
    environments = environments == null ? Map.of() : Map.copyOf(environments);
  }

  public EnvironmentProperties environment(String name) {
    final EnvironmentProperties environment = environments.get(name);
    if (environment == null) {
      throw new ConfigurationException(
          "unknown environment " + name + "; configured: " + new TreeSet<>(environments.keySet()));
    }
    return environment;
  }
}
