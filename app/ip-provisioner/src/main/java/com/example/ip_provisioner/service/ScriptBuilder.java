/*
 * どこで: プロビジョニングのサービス層
 * 何を: アドレス差分を再実行可能な insert-if-absent スクリプトに変換する
 * なぜ: bulk 戦略はアドレスごとの文ではなく 1 つの成果物をロードするため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.AddressRecord;
import com.example.ip_provisioner.model.ArtifactHeader;
import com.example.ip_provisioner.model.ArtifactKind;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.PrimitiveIterator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScriptBuilder {

  private static final Logger logger = LoggerFactory.getLogger(ScriptBuilder.class);
  static final String INSERT_PREFIX =
      "INSERT INTO ipaddress_inside_regional (region, address, \"timestamp\", inuse) VALUES";
  static final String ON_CONFLICT = "ON CONFLICT (region, address) DO NOTHING;";

  private final ProvisionerProperties properties;
  private final Clock clock;

  /**
   * 役割: {@code delta} のスクリプトを新しい一時ファイルに書き出す。
   * 前提: 返却された成果物は呼び出し側が所有し、close すること。
   */
  public TemporaryArtifact build(String region, AddressDelta delta) {
    final ArtifactHeader header =
        new ArtifactHeader(ArtifactKind.PROVISION, region, Instant.now(clock), delta.size());
    final Path path = createTempFile(region);
    int statements = 0;
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (String line : header.toCommentLines()) {
        writeLine(writer, line);
      }
      writeLine(writer, "BEGIN;");
      writeLine(writer, "SET CONSTRAINTS ALL DEFERRED;");
      final String regionLiteral = SqlLiterals.string(region);
      final String timestampLiteral =
          SqlLiterals.timestamp(AddressRecord.UNKNOWN_ALLOCATION_TIME);
      final int batchSize = properties.batchSize();
      final PrimitiveIterator.OfLong addresses = delta.stream().iterator();
      while (addresses.hasNext()) {
        writeLine(writer, INSERT_PREFIX);
        int inBatch = 0;
        while (addresses.hasNext() && inBatch < batchSize) {
          final long address = addresses.nextLong();
          final String separator = inBatch == 0 ? "  " : ", ";
          writeLine(
              writer,
              separator
                  + "("
                  + regionLiteral
                  + ", "
                  + address
                  + ", "
                  + timestampLiteral
                  + ", FALSE)");
          inBatch++;
        }
        writeLine(writer, ON_CONFLICT);
        statements++;
      }
      writeLine(writer, "SET CONSTRAINTS ALL IMMEDIATE;");
      writeLine(writer, "COMMIT;");
    } catch (IOException ex) {
      deleteQuietly(path);
      throw new UncheckedIOException("failed to write provisioning script " + path, ex);
    }
    logger.debug(
        "provisioning script written region={} path={} addresses={} statements={}",
        region,
        path,
        delta.size(),
        statements);
    return new TemporaryArtifact(path, header, statements);
  }

  private Path createTempFile(String region) {
    try {
      final String prefix = "provision_" + region + "_";
      return properties.tempDir() == null
          ? Files.createTempFile(prefix, ".sql")
          : Files.createTempFile(
              Files.createDirectories(properties.tempDir()), prefix, ".sql");
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to create provisioning script file", ex);
    }
  }

  private static void writeLine(BufferedWriter writer, String line) throws IOException {
    writer.write(line);
    writer.newLine();
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException suppressed) {
      logger.warn("partial provisioning script left behind path={}", path, suppressed);
    }
  }
}
