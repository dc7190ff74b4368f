/*
 * どこで: プロビジョニングのサービス層
 * 何を: 呼び出し側のトランザクション内で成果物の文を実行する
 * なぜ: 呼び出し側が既にリージョンロックを保持しているため、成果物内の BEGIN/COMMIT は飛ばす
 */
package com.example.ip_provisioner.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class SqlArtifactExecutor {

  private static final Logger logger = LoggerFactory.getLogger(SqlArtifactExecutor.class);
  private static final Set<String> TRANSACTION_CONTROL =
      Set.of("BEGIN;", "COMMIT;", "ROLLBACK;", "START TRANSACTION;", "END;");

  // '1970-01-01 00:00:00' のようなリテラルを名前付きパラメータとして解釈させないため JdbcTemplate を使う
  private final JdbcTemplate jdbcTemplate;

  public record Summary(int statements, long rowsInserted, long rowsDeleted) {}

  @Transactional(propagation = Propagation.MANDATORY)
  public Summary execute(SqlArtifactReader reader) {
    int statements = 0;
    long inserted = 0;
    long deleted = 0;
    try {
      Optional<String> next;
      while ((next = reader.nextStatement()).isPresent()) {
        final String statement = next.get();
        final String normalized = statement.toUpperCase(Locale.ROOT);
        if (TRANSACTION_CONTROL.contains(normalized)) {
          continue;
        }
        if (normalized.startsWith("INSERT")) {
          inserted += jdbcTemplate.update(stripTerminator(statement));
        } else if (normalized.startsWith("DELETE")) {
          deleted += jdbcTemplate.update(stripTerminator(statement));
        } else {
          jdbcTemplate.execute(stripTerminator(statement));
        }
        statements++;
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read artifact " + reader.path(), ex);
    }
    logger.debug(
        "artifact executed path={} statements={} inserted={} deleted={}",
        reader.path(),
        statements,
        inserted,
        deleted);
    return new Summary(statements, inserted, deleted);
  }

  private static String stripTerminator(String statement) {
    return statement.substring(0, statement.length() - 1);
  }
}
