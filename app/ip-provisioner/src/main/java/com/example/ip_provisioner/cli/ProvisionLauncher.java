/*
 * どこで: ip-provisioner コマンドライン
 * 何を: プロビジョニングまたはロールバックを実行し、結果を終了コードに変換する
 * なぜ: どの失敗でも運用者が対処できるログを 1 行残すため
 */
package com.example.ip_provisioner.cli;

import static com.google.common.base.MoreObjects.firstNonNull;

import com.example.common.RunIds;
import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.ProvisioningOutcome;
import com.example.ip_provisioner.model.ProvisioningRequest;
import com.example.ip_provisioner.model.RollbackOutcome;
import com.example.ip_provisioner.service.BackupNotFoundException;
import com.example.ip_provisioner.service.LockContentionException;
import com.example.ip_provisioner.service.ProvisioningException;
import com.example.ip_provisioner.service.ProvisioningService;
import com.example.ip_provisioner.service.RangeDiff;
import com.example.ip_provisioner.service.RegionNotFoundException;
import com.example.ip_provisioner.service.RollbackFailedException;
import com.example.ip_provisioner.service.RollbackOrchestrator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProvisionLauncher {

  private static final Logger logger = LoggerFactory.getLogger(ProvisionLauncher.class);
  static final String MDC_RUN_ID = "run_id";
  static final String MDC_REGION = "region";

  private final ProvisionerProperties properties;
  private final ProvisioningService provisioningService;
  private final RollbackOrchestrator rollbackOrchestrator;

  public ExitCode launch(CliOptions options) {
    MDC.put(MDC_RUN_ID, RunIds.newRunId());
    MDC.put(MDC_REGION, options.apiRegion());
    try {
      if (options.rollbackRequested()) {
        final RollbackOutcome outcome =
            rollbackOrchestrator.rollback(options.rollback(), options.apiRegion());
        logger.info(
            "rollback finished region={} restored={} path={}",
            outcome.region(),
            outcome.rowsRestored(),
            outcome.path());
        return ExitCode.SUCCESS;
      }
      final ProvisioningOutcome outcome = provisioningService.provision(toRequest(options));
      if (outcome.cancelled()) {
        return ExitCode.CANCELLED;
      }
      if (!outcome.rollbackAvailable() && outcome.deltaSize() > 0) {
        logger.warn("no backup was taken for this run, rollback unavailable");
      }
      return ExitCode.SUCCESS;
    } catch (RegionNotFoundException ex) {
      logger.error("region {} is not in the region catalog; check --api_region", ex.region());
      return ExitCode.of(ex.reason());
    } catch (LockContentionException ex) {
      logger.error(
          "region {} is being provisioned by another run; retry once it has finished", ex.region());
      return ExitCode.of(ex.reason());
    } catch (BackupNotFoundException ex) {
      logger.error("backup artifact {} does not exist; nothing was changed", ex.path());
      return ExitCode.of(ex.reason());
    } catch (RollbackFailedException ex) {
      logger.error("MANUAL INTERVENTION REQUIRED: {}", ex.getMessage(), ex);
      return ExitCode.of(ex.reason());
    } catch (ProvisioningException ex) {
      logger.error("{} failure: {}", ex.reason(), ex.getMessage(), ex);
      return ExitCode.of(ex.reason());
    } catch (RuntimeException ex) {
      logger.error("unexpected failure", ex);
      return ExitCode.UNEXPECTED;
    } finally {
      MDC.remove(MDC_RUN_ID);
      MDC.remove(MDC_REGION);
    }
  }

  ProvisioningRequest toRequest(CliOptions options) {
    return new ProvisioningRequest(
        options.apiRegion(),
        RangeDiff.parseRange(
            firstNonNull(options.expandedRange(), properties.expandedRange()), "expanded"),
        RangeDiff.parseRange(
            firstNonNull(options.currentRange(), properties.currentRange()), "current"),
        firstNonNull(options.includeBroadcast(), properties.includeBroadcast()),
        firstNonNull(options.strategy(), properties.insertStrategy()),
        options.backupDir(),
        options.force());
  }
}
