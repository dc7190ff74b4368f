/*
 * どこで: プロビジョニングのサービス層
 * 何を: プロビジョニング前にリージョンのインベントリ行を復元用成果物へ保存する
 * なぜ: コミット済みのプロビジョニングはこの成果物の再生でしか取り消せないため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.AddressRecord;
import com.example.ip_provisioner.model.ArtifactHeader;
import com.example.ip_provisioner.model.ArtifactKind;
import com.example.ip_provisioner.model.BackupArtifact;
import com.example.ip_provisioner.repository.AddressRepository;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class BackupManager {

  private static final Logger logger = LoggerFactory.getLogger(BackupManager.class);
  static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

  private final AddressRepository addressRepository;
  private final ProvisionerProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: {@code region} の復元用成果物を書き出す。
   *
   * @param directory 出力先ディレクトリ。null の場合は設定の既定値を使う
   * @return リージョンに行がなく復元対象がない場合は empty
   */
  public Optional<BackupArtifact> backup(String region, Path directory) {
    final Path targetDir = directory != null ? directory : properties.backupDir();
    final Instant capturedAt = Instant.now(clock);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    // 件数と走査は同じスナップショットを参照する
    transactionTemplate.setReadOnly(true);
    transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    final BackupArtifact artifact =
        transactionTemplate.execute(status -> writeSnapshot(region, targetDir, capturedAt));
    if (artifact == null) {
      logger.warn("backup skipped because region has no rows region={}", region);
      return Optional.empty();
    }
    logger.info(
        "backup written region={} path={} records={}",
        region,
        artifact.path(),
        artifact.recordCount());
    return Optional.of(artifact);
  }

  static String fileName(String region, Instant capturedAt) {
    return "backup_" + region + "_" + FILE_TIMESTAMP.format(capturedAt) + ".sql";
  }

  private BackupArtifact writeSnapshot(String region, Path targetDir, Instant capturedAt) {
    final long expected = addressRepository.countByRegion(region);
    if (expected == 0) {
      return null;
    }
    final ArtifactHeader header =
        new ArtifactHeader(ArtifactKind.RESTORE, region, capturedAt, expected);
    final Path path;
    try {
      path = Files.createDirectories(targetDir).resolve(fileName(region, capturedAt));
    } catch (IOException ex) {
      throw new ProvisioningFailedException("cannot create backup directory " + targetDir, ex);
    }
    final BufferedWriter output;
    try {
      output =
          Files.newBufferedWriter(
              path, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (IOException ex) {
      // 同名の既存成果物は別の取得のものなので消さない
      throw new ProvisioningFailedException("cannot create backup " + path, ex);
    }
    final long written;
    try (BufferedWriter writer = output) {
      final RestoreScriptWriter script = new RestoreScriptWriter(writer, properties.batchSize());
      script.begin(header);
      addressRepository.streamByRegion(region, properties.batchSize(), script::append);
      written = script.finish();
    } catch (IOException | UncheckedIOException ex) {
      deletePartial(path);
      throw new ProvisioningFailedException("failed to write backup " + path, ex);
    } catch (RuntimeException ex) {
      deletePartial(path);
      throw ex;
    }
    if (written != expected) {
      deletePartial(path);
      throw new ProvisioningFailedException(
          "backup "
              + path
              + " is incomplete: expected "
              + expected
              + " rows but wrote "
              + written,
          null);
    }
    return new BackupArtifact(path, region, capturedAt, written);
  }

  private static void deletePartial(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException suppressed) {
      logger.warn("partial backup left behind path={}", path, suppressed);
    }
  }

  /** 役割: 削除と再挿入の文を {@code batchSize} 行ごとにまとめて出力する。 */
  private static final class RestoreScriptWriter {

    private static final String INSERT_PREFIX =
        "INSERT INTO ipaddress_inside_regional (region, address, \"timestamp\", inuse) VALUES";

    private final BufferedWriter writer;
    private final int batchSize;
    private int inBatch;
    private long written;

    RestoreScriptWriter(BufferedWriter writer, int batchSize) {
      this.writer = writer;
      this.batchSize = batchSize;
    }

    void begin(ArtifactHeader header) throws IOException {
      for (String line : header.toCommentLines()) {
        line(line);
      }
      line("BEGIN;");
      line(
          "DELETE FROM ipaddress_inside_regional WHERE region = "
              + SqlLiterals.string(header.region())
              + ";");
    }

    void append(AddressRecord record) {
      try {
        if (inBatch == 0) {
          line(INSERT_PREFIX);
        }
        line(
            (inBatch == 0 ? "  (" : ", (")
                + SqlLiterals.string(record.region())
                + ", "
                + record.address()
                + ", "
                + SqlLiterals.timestamp(record.timestamp())
                + ", "
                + SqlLiterals.bool(record.inuse())
                + ")");
        inBatch++;
        written++;
        if (inBatch == batchSize) {
          closeBatch();
        }
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }

    long finish() throws IOException {
      if (inBatch > 0) {
        closeBatch();
      }
      line("COMMIT;");
      return written;
    }

    private void closeBatch() throws IOException {
      line(";");
      inBatch = 0;
    }

    private void line(String text) throws IOException {
      writer.write(text);
      writer.newLine();
    }
  }
}
