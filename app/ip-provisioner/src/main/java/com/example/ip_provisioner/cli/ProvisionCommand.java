/*
 * どこで: ip-provisioner コマンドライン
 * 何を: CLI フラグを定義し、解析済みオプションをアプリケーションに渡す
 * なぜ: Spring コンテキストや DB 接続を作る前にフラグを検証するため
 */
package com.example.ip_provisioner.cli;

import com.example.ip_provisioner.model.InsertStrategyType;
import com.example.ip_provisioner.service.ConfigurationException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.ToIntFunction;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@SuppressFBWarnings(
    value = "UWF_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
    justification = "option fields are populated by picocli before call()")
@Command(
    name = "ip-provisioner",
    mixinStandardHelpOptions = true,
    description = "Provisions the addresses added by a network range expansion into a region")
public class ProvisionCommand implements Callable<Integer> {

  static final String LOCAL_ENVIRONMENT = "local";

  @Option(names = "--env", description = "Target environment", defaultValue = "dev")
  String environment;

  @Option(names = "--api_region", required = true, description = "Region whose inventory is provisioned")
  String apiRegion;

  @Option(names = "--db_region", description = "AWS region of the inventory database secret")
  String dbRegion;

  @Option(names = "--debug", description = "Enable debug logging")
  boolean debug;

  @Option(names = "--force", description = "Skip confirmation prompts")
  boolean force;

  @Option(names = "--rollback", paramLabel = "<path>", description = "Restore a region from a backup artifact")
  Path rollback;

  @Option(names = "--backup-dir", paramLabel = "<path>", description = "Directory for the backup artifact")
  Path backupDir;

  @Option(names = "--expanded-range", paramLabel = "<cidr>", description = "Range after the expansion")
  String expandedRange;

  @Option(names = "--current-range", paramLabel = "<cidr>", description = "Range before the expansion")
  String currentRange;

  @Option(names = "--strategy", description = "Insert strategy: ${COMPLETION-CANDIDATES}")
  InsertStrategyType strategy;

  @Option(names = "--include-broadcast", description = "Also provision the broadcast address of the expanded range")
  Boolean includeBroadcast;

  private final ToIntFunction<CliOptions> runner;

  public ProvisionCommand(ToIntFunction<CliOptions> runner) {
    this.runner = runner;
  }

  @Override
  public Integer call() {
    return runner.applyAsInt(toOptions());
  }

  CliOptions toOptions() {
    if (!LOCAL_ENVIRONMENT.equals(environment) && (dbRegion == null || dbRegion.isBlank())) {
      throw new ConfigurationException("--db_region is required for environment " + environment);
    }
    return new CliOptions(
        environment,
        apiRegion,
        dbRegion,
        debug,
        force,
        rollback,
        backupDir,
        expandedRange,
        currentRange,
        strategy,
        includeBroadcast);
  }
}
