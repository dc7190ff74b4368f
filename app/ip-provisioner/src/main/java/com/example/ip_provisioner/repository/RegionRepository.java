/*
 * どこで: ip-provisioner データアクセス
 * 何を: リージョンカタログを参照し、リージョン単位のプロビジョニングロックを取る
 * なぜ: 更新を伴う実行はインベントリ行に触れる前に対象リージョンの行をロックするため
 */
package com.example.ip_provisioner.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class RegionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean exists(String region) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM region WHERE region_name = :region
        )
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("region", region);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<String> findAllNames() {
    final String sql =
        """
        SELECT region_name
        FROM region
        ORDER BY region_name
        """;
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class);
  }

  /**
   * 役割: 外側のトランザクションが終わるまで {@code region} のカタログ行をロックする。
   *
   * <p>動作: NOWAIT により、競合する保持者がいれば待たずに SQLState 55P03 で失敗する。
   *
   * @return リージョンのカタログ行が存在しない場合は false
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean lockForUpdateNoWait(String region) {
    final String sql =
        """
        SELECT region_name
        FROM region
        WHERE region_name = :region
        FOR UPDATE NOWAIT
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("region", region);
    return !jdbcTemplate.queryForList(sql, params, String.class).isEmpty();
  }
}
