/*
 * どこで: プロビジョニングのサービス層
 * 何を: 現在のトランザクションでリージョンの排他ロックを待たずに取得する
 * なぜ: 同じリージョンへの 2 つ目の実行は待たずに即座に失敗させるため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.repository.RegionRepository;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class RegionLock {

  private static final Logger logger = LoggerFactory.getLogger(RegionLock.class);
  static final String LOCK_NOT_AVAILABLE = "55P03";

  private final RegionRepository regionRepository;

  /**
   * 役割: 外側のトランザクションがコミットまたはロールバックするまで {@code region} をロックする。
   *
   * @throws LockContentionException 別のトランザクションがロックを保持している場合
   * @throws RegionNotFoundException リージョンがカタログに存在しない場合
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public void acquire(String region) {
    final boolean locked;
    try {
      locked = regionRepository.lockForUpdateNoWait(region);
    } catch (DataAccessException ex) {
      if (isLockContention(ex)) {
        logger.warn("region lock unavailable region={}", region);
        throw new LockContentionException(region, ex);
      }
      throw ex;
    }
    if (!locked) {
      throw new RegionNotFoundException(region);
    }
    logger.debug("region lock acquired region={}", region);
  }

  static boolean isLockContention(Throwable ex) {
    if (ex instanceof PessimisticLockingFailureException) {
      return true;
    }
    for (Throwable current = ex; current != null; current = current.getCause()) {
      if (current instanceof SQLException sqlException
          && LOCK_NOT_AVAILABLE.equals(sqlException.getSQLState())) {
        return true;
      }
    }
    return false;
  }
}
