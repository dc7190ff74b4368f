/*
 * どこで: プロビジョニングのサービス層
 * 何を: バックアップ成果物からリージョンを復元する
 * なぜ: コミット済みのプロビジョニングの取り消しは運用者の明示操作とするため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ArtifactHeader;
import com.example.ip_provisioner.model.ArtifactKind;
import com.example.ip_provisioner.model.RollbackOutcome;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class RollbackOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(RollbackOrchestrator.class);

  private final RegionLock regionLock;
  private final SqlArtifactExecutor artifactExecutor;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: {@code path} の復元用成果物を、成果物が名乗るリージョンのロック下で再生する。
   * 前提: 成果物のリージョンは {@code expectedRegion} と一致すること。
   *
   * @throws BackupNotFoundException {@code path} にファイルが存在しない場合
   * @throws ConfigurationException 成果物が不正、またはリージョンが一致しない場合
   * @throws RollbackFailedException 再生に失敗した場合
   */
  public RollbackOutcome rollback(Path path, String expectedRegion) {
    if (!Files.isRegularFile(path)) {
      throw new BackupNotFoundException(path);
    }
    try (SqlArtifactReader reader = SqlArtifactReader.open(path)) {
      final ArtifactHeader header = readRestoreHeader(reader);
      if (!header.region().equals(expectedRegion)) {
        throw new ConfigurationException(
            path
                + " is a backup of region "
                + header.region()
                + ", not of "
                + expectedRegion
                + "; nothing was changed");
      }
      logger.info(
          "rollback started region={} path={} records={}",
          header.region(),
          path,
          header.recordCount());
      final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
      final RollbackOutcome outcome =
          transactionTemplate.execute(
              status -> {
                regionLock.acquire(header.region());
                final SqlArtifactExecutor.Summary summary = artifactExecutor.execute(reader);
                if (summary.rowsInserted() != header.recordCount()) {
                  throw new IllegalStateException(
                      "restored "
                          + summary.rowsInserted()
                          + " rows but the backup holds "
                          + header.recordCount());
                }
                return new RollbackOutcome(
                    path, header.region(), summary.rowsDeleted(), summary.rowsInserted());
              });
      logger.info(
          "rollback completed region={} deleted={} restored={}",
          outcome.region(),
          outcome.rowsDeleted(),
          outcome.rowsRestored());
      return outcome;
    } catch (ConfigurationException | LockContentionException | RegionNotFoundException ex) {
      // 何も再生されていない
      throw ex;
    } catch (IOException | RuntimeException ex) {
      logger.error("rollback failed path={} manual intervention required", path, ex);
      throw new RollbackFailedException(path, ex.getMessage(), ex);
    }
  }

  private static ArtifactHeader readRestoreHeader(SqlArtifactReader reader) {
    final ArtifactHeader header;
    try {
      header =
          reader
              .header()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          reader.path() + " is not an ip-provisioner backup artifact"));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(
          reader.path() + " has a malformed artifact header: " + ex.getMessage(), ex);
    }
    if (header.kind() != ArtifactKind.RESTORE) {
      throw new ConfigurationException(
          reader.path() + " is a " + header.kind() + " artifact, not a backup");
    }
    return header;
  }
}
