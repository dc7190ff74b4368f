/*
 * どこで: プロビジョニングのサービス層
 * 何を: 検証、差分計算、確認、バックアップ、挿入の順に 1 回のプロビジョニングを行う
 * なぜ: 書き込みなしで失敗し得る検証をロック付きトランザクションの前に済ませるため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.BackupArtifact;
import com.example.ip_provisioner.model.InsertResult;
import com.example.ip_provisioner.model.NetworkRange;
import com.example.ip_provisioner.model.ProvisioningOutcome;
import com.example.ip_provisioner.model.ProvisioningRequest;
import com.example.ip_provisioner.model.RollbackOutcome;
import com.example.ip_provisioner.repository.RegionRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProvisioningService {

  private static final Logger logger = LoggerFactory.getLogger(ProvisioningService.class);

  private final RegionRepository regionRepository;
  private final RangeDiff rangeDiff;
  private final BackupManager backupManager;
  private final AddressInserter addressInserter;
  private final RollbackOrchestrator rollbackOrchestrator;
  private final ExecutionDriver executionDriver;
  private final OperatorPrompt operatorPrompt;

  public ProvisioningOutcome provision(ProvisioningRequest request) {
    final String region = request.region();
    if (!executionDriver.run(() -> regionRepository.exists(region))) {
      throw new RegionNotFoundException(region);
    }
    final AddressDelta delta =
        rangeDiff.compute(request.expandedRange(), request.currentRange(), request.includeBroadcast());
    logPreview(request, delta);
    if (delta.isEmpty()) {
      logger.info("nothing to provision region={}", region);
      return new ProvisioningOutcome(
          region, 0, InsertResult.empty(request.strategy()), Optional.empty(), false);
    }
    if (!request.force()
        && !operatorPrompt.confirm(
            "Provision " + delta.size() + " addresses into region " + region + "?")) {
      logger.info("provisioning cancelled by operator region={}", region);
      return new ProvisioningOutcome(
          region, delta.size(), InsertResult.empty(request.strategy()), Optional.empty(), true);
    }

    final Optional<BackupArtifact> backup =
        executionDriver.run(() -> backupManager.backup(region, request.backupDir()));
    if (backup.isEmpty()) {
      logger.warn("region has no existing rows, rollback unavailable region={}", region);
    }

    final InsertResult result;
    try {
      result = executionDriver.run(() -> addressInserter.apply(region, delta, request.strategy()));
    } catch (LockContentionException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      offerRollback(request, backup, ex);
      throw ex;
    }
    logger.info(
        "provisioning completed region={} delta={} inserted={} skipped={} backup={}",
        region,
        delta.size(),
        result.insertedCount(),
        result.skippedCount(),
        backup.map(BackupArtifact::path).map(Object::toString).orElse("none"));
    return new ProvisioningOutcome(region, delta.size(), result, backup, false);
  }

  private void logPreview(ProvisioningRequest request, AddressDelta delta) {
    logger.info(
        "provisioning preview region={} expanded={} current={} broadcast={} strategy={} delta={} first={} last={}",
        request.region(),
        request.expandedRange(),
        request.currentRange(),
        request.includeBroadcast(),
        request.strategy(),
        delta.size(),
        delta.first().isPresent() ? NetworkRange.formatAddress(delta.first().getAsLong()) : "-",
        delta.last().isPresent() ? NetworkRange.formatAddress(delta.last().getAsLong()) : "-");
  }

  private void offerRollback(
      ProvisioningRequest request, Optional<BackupArtifact> backup, RuntimeException failure) {
    final String region = request.region();
    if (backup.isEmpty()) {
      logger.error("provisioning failed region={} rollback unavailable", region, failure);
      return;
    }
    final BackupArtifact artifact = backup.get();
    logger.error(
        "provisioning failed region={} restore with --rollback {}", region, artifact.path(), failure);
    if (request.force()
        || !operatorPrompt.confirm(
            "Provisioning failed. Roll back region " + region + " from " + artifact.path() + "?")) {
      return;
    }
    try {
      final RollbackOutcome outcome =
          executionDriver.run(() -> rollbackOrchestrator.rollback(artifact.path(), region));
      logger.info(
          "region restored after failure region={} restored={}", region, outcome.rowsRestored());
    } catch (ProvisioningException rollbackFailure) {
      rollbackFailure.addSuppressed(failure);
      throw rollbackFailure;
    }
  }
}
