/*
 * どこで: ip-provisioner データアクセス
 * 何を: ipaddress_inside_regional の行を読み書きする
 * なぜ: バックアップはリージョン全体を流すため、一覧取得ではなくカーソルで読む
 */
package com.example.ip_provisioner.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.ip_provisioner.model.AddressRecord;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class AddressRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: リージョンに存在しない場合だけ未割り当てのアドレスを挿入する。
   *
   * @return 行を作成した場合は 1、既に存在した場合は 0
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public int insertIfAbsent(AddressRecord record) {
    final String sql =
        """
        INSERT INTO ipaddress_inside_regional (region, address, "timestamp", inuse)
        VALUES (:region, :address, :timestamp, :inuse)
        ON CONFLICT (region, address) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("region", record.region())
            .addValue("address", record.address())
            .addValue("timestamp", toTimestamp(record.timestamp()))
            .addValue("inuse", record.inuse());
    return jdbcTemplate.update(sql, params);
  }

  public long countByRegion(String region) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM ipaddress_inside_regional
        WHERE region = :region
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("region", region);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  /**
   * 役割: {@code region} の全行をアドレス順に {@code sink} へ流す。
   *
   * <p>前提: PostgreSQL ドライバはトランザクション内でのみ fetch size を反映するため、
   * 呼び出し側はトランザクションを保持すること。保持しない場合はリージョン全体がバッファされる。
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public void streamByRegion(String region, int fetchSize, Consumer<AddressRecord> sink) {
    final String sql =
        """
        SELECT region, address, "timestamp", inuse
        FROM ipaddress_inside_regional
        WHERE region = ?
        ORDER BY address
        """;
    final RowCallbackHandler handler = rs -> sink.accept(mapRow(rs));
    jdbcTemplate
        .getJdbcTemplate()
        .query(
            connection -> {
              final PreparedStatement statement = connection.prepareStatement(sql);
              statement.setFetchSize(fetchSize);
              statement.setString(1, region);
              return statement;
            },
            handler);
  }

  private AddressRecord mapRow(ResultSet rs) throws SQLException {
    return new AddressRecord(
        rs.getString("region"),
        rs.getLong("address"),
        toInstant(rs.getTimestamp("timestamp")),
        rs.getBoolean("inuse"));
  }
}
