package com.example.ip_provisioner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.ip_provisioner.AbstractPostgresContainerTest;
import com.example.ip_provisioner.InventoryRows;
import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.AddressRecord;
import com.example.ip_provisioner.model.ArtifactKind;
import com.example.ip_provisioner.model.BackupArtifact;
import com.example.ip_provisioner.repository.AddressRepository;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

@SpringBootTest
@ActiveProfiles("test")
class BackupManagerTest extends AbstractPostgresContainerTest {

  private static final Instant CAPTURED_AT = Instant.parse("2024-05-01T10:15:30.042Z");

  @TempDir Path backupDir;

  @Autowired private AddressRepository addressRepository;

  @Autowired private ProvisionerProperties properties;

  @Autowired private PlatformTransactionManager transactionManager;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private BackupManager backupManager;

  @BeforeEach
  void setUp() {
    InventoryRows.deleteAll(jdbcTemplate);
    backupManager =
        new BackupManager(
            addressRepository,
            properties,
            Clock.fixed(CAPTURED_AT, ZoneOffset.UTC),
            transactionManager);
  }

  @Test
  void emptyRegionProducesNoBackup() {
    assertThat(backupManager.backup("us-east-1", backupDir)).isEmpty();
    assertThat(backupDir).isEmptyDirectory();
  }

  @Test
  void writesRestoreArtifactNamedByRegionAndCaptureTime() throws Exception {
    for (long address = 1; address <= 120; address++) {
      InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("us-east-1", address));
    }
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("eu-west-1", 7L));

    final Optional<BackupArtifact> backup = backupManager.backup("us-east-1", backupDir);

    assertThat(backup).isPresent();
    final BackupArtifact artifact = backup.get();
    assertThat(artifact.path().getFileName())
        .hasToString("backup_us-east-1_20240501T101530042Z.sql");
    assertThat(artifact.recordCount()).isEqualTo(120);
    try (SqlArtifactReader reader = SqlArtifactReader.open(artifact.path())) {
      assertThat(reader.header().orElseThrow().kind()).isEqualTo(ArtifactKind.RESTORE);
      assertThat(reader.header().orElseThrow().recordCount()).isEqualTo(120);
      assertThat(reader.nextStatement()).hasValue("BEGIN;");
      assertThat(reader.nextStatement())
          .hasValue("DELETE FROM ipaddress_inside_regional WHERE region = 'us-east-1';");
    }
    assertThat(Files.readString(artifact.path())).doesNotContain("eu-west-1").contains("COMMIT;");
  }

  @Test
  void existingArtifactIsNeverOverwritten() throws Exception {
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("us-east-1", 1L));
    final BackupArtifact first = backupManager.backup("us-east-1", backupDir).orElseThrow();
    final String original = Files.readString(first.path());
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("us-east-1", 2L));

    assertThatThrownBy(() -> backupManager.backup("us-east-1", backupDir))
        .isInstanceOf(ProvisioningFailedException.class)
        .hasRootCauseInstanceOf(FileAlreadyExistsException.class);
    assertThat(Files.readString(first.path())).isEqualTo(original);
  }

  @Test
  void defaultDirectoryIsUsedWithoutOverride() throws Exception {
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("eu-west-1", 1L));

    final BackupArtifact artifact = backupManager.backup("eu-west-1", null).orElseThrow();
    try {
      assertThat(artifact.path().getParent()).isEqualTo(properties.backupDir());
      assertThat(artifact.path()).exists();
    } finally {
      Files.deleteIfExists(artifact.path());
    }
  }
}
