package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ArtifactHeader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** close 時に削除される生成スクリプトファイル。 */
public final class TemporaryArtifact implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TemporaryArtifact.class);

  private final Path path;
  private final ArtifactHeader header;
  private final int statementCount;

  TemporaryArtifact(Path path, ArtifactHeader header, int statementCount) {
    this.path = path;
    this.header = header;
    this.statementCount = statementCount;
  }

  public Path path() {
    return path;
  }

  public ArtifactHeader header() {
    return header;
  }

  public int statementCount() {
    return statementCount;
  }

  @Override
  public void close() {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      logger.warn("temporary artifact could not be deleted path={}", path, ex);
    }
  }
}
