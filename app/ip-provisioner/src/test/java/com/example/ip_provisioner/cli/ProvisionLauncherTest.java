package com.example.ip_provisioner.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.ip_provisioner.TestProperties;
import com.example.ip_provisioner.model.InsertResult;
import com.example.ip_provisioner.model.InsertStrategyType;
import com.example.ip_provisioner.model.ProvisioningOutcome;
import com.example.ip_provisioner.model.ProvisioningRequest;
import com.example.ip_provisioner.model.RollbackOutcome;
import com.example.ip_provisioner.service.BackupNotFoundException;
import com.example.ip_provisioner.service.ConfigurationException;
import com.example.ip_provisioner.service.LockContentionException;
import com.example.ip_provisioner.service.ProvisioningService;
import com.example.ip_provisioner.service.RegionNotFoundException;
import com.example.ip_provisioner.service.RollbackOrchestrator;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

class ProvisionLauncherTest {

  @TempDir Path workDir;

  private final ProvisioningService provisioningService = mock(ProvisioningService.class);
  private final RollbackOrchestrator rollbackOrchestrator = mock(RollbackOrchestrator.class);
  private ProvisionLauncher launcher;

  @BeforeEach
  void setUp() {
    launcher =
        new ProvisionLauncher(
            TestProperties.withBatchSize(10, workDir), provisioningService, rollbackOrchestrator);
  }

  private static CliOptions options(Path rollback, InsertStrategyType strategy) {
    return new CliOptions(
        "local", "us-east-1", null, false, true, rollback, null, null, null, strategy, null);
  }

  @Test
  void provisioningFallsBackToConfiguredRanges() {
    when(provisioningService.provision(any()))
        .thenReturn(
            new ProvisioningOutcome(
                "us-east-1", 256, new InsertResult(InsertStrategyType.ROW, 256, 0), Optional.empty(), false));

    assertThat(launcher.launch(options(null, InsertStrategyType.ROW))).isEqualTo(ExitCode.SUCCESS);

    final ArgumentCaptor<ProvisioningRequest> request =
        ArgumentCaptor.forClass(ProvisioningRequest.class);
    verify(provisioningService).provision(request.capture());
    assertThat(request.getValue().expandedRange().toString()).isEqualTo("10.0.0.0/23");
    assertThat(request.getValue().currentRange().toString()).isEqualTo("10.0.0.0/24");
    assertThat(request.getValue().strategy()).isEqualTo(InsertStrategyType.ROW);
    assertThat(request.getValue().force()).isTrue();
    assertThat(MDC.get("run_id")).isNull();
  }

  @Test
  void declinedConfirmationIsCancelled() {
    when(provisioningService.provision(any()))
        .thenReturn(
            new ProvisioningOutcome(
                "us-east-1", 256, InsertResult.empty(InsertStrategyType.BULK), Optional.empty(), true));

    assertThat(launcher.launch(options(null, null))).isEqualTo(ExitCode.CANCELLED);
  }

  @Test
  void rollbackFlagDispatchesToTheOrchestrator() {
    final Path backup = workDir.resolve("backup.sql");
    when(rollbackOrchestrator.rollback(backup, "us-east-1"))
        .thenReturn(new RollbackOutcome(backup, "us-east-1", 3, 2));

    assertThat(launcher.launch(options(backup, null))).isEqualTo(ExitCode.SUCCESS);
    verifyNoInteractions(provisioningService);
  }

  @Test
  void failuresMapToTheirExitCodes() {
    when(provisioningService.provision(any()))
        .thenThrow(new RegionNotFoundException("mars-1"))
        .thenThrow(new LockContentionException("us-east-1", null))
        .thenThrow(new IllegalStateException("boom"));

    assertThat(launcher.launch(options(null, null))).isEqualTo(ExitCode.REGION_NOT_FOUND);
    assertThat(launcher.launch(options(null, null))).isEqualTo(ExitCode.LOCK_CONTENTION);
    assertThat(launcher.launch(options(null, null))).isEqualTo(ExitCode.UNEXPECTED);
  }

  @Test
  void missingBackupMapsToItsExitCode() {
    final Path missing = workDir.resolve("missing.sql");
    when(rollbackOrchestrator.rollback(missing, "us-east-1"))
        .thenThrow(new BackupNotFoundException(missing));

    assertThat(launcher.launch(options(missing, null))).isEqualTo(ExitCode.BACKUP_NOT_FOUND);
  }

  @Test
  void rollbackIsCheckedAgainstTheApiRegion() {
    final Path backup = workDir.resolve("backup_eu-west-1.sql");
    when(rollbackOrchestrator.rollback(backup, "us-east-1"))
        .thenThrow(new ConfigurationException(backup + " is a backup of region eu-west-1"));

    assertThat(launcher.launch(options(backup, null))).isEqualTo(ExitCode.CONFIGURATION);
    verify(rollbackOrchestrator).rollback(backup, "us-east-1");
  }
}
