package com.example.ip_provisioner.cli;

import com.example.ip_provisioner.model.InsertStrategyType;
import java.nio.file.Path;

/**
 * 1 回の実行の解析済みコマンドライン。レンジ、戦略、ブロードキャストが null の場合は
 * {@code provisioner.*} の設定値を使う。
 */
public record CliOptions(
    String environment,
    String apiRegion,
    String dbRegion,
    boolean debug,
    boolean force,
    Path rollback,
    Path backupDir,
    String expandedRange,
    String currentRange,
    InsertStrategyType strategy,
    Boolean includeBroadcast) {

  public boolean rollbackRequested() {
    return rollback != null;
  }
}
