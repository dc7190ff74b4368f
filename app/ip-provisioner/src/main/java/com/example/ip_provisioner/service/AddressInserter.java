/*
 * どこで: プロビジョニングのサービス層
 * 何を: リージョンロックの下で差分を単一トランザクションで適用する
 * なぜ: 新規アドレスを全件コミットするか、1 件もコミットしないかのどちらかにするため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.InsertResult;
import com.example.ip_provisioner.model.InsertStrategyType;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AddressInserter {

  private static final Logger logger = LoggerFactory.getLogger(AddressInserter.class);

  private final RegionLock regionLock;
  private final PlatformTransactionManager transactionManager;
  private final Map<InsertStrategyType, InsertStrategy> strategies;

  public AddressInserter(
      RegionLock regionLock,
      PlatformTransactionManager transactionManager,
      List<InsertStrategy> strategies) {
    this.regionLock = regionLock;
    this.transactionManager = transactionManager;
    this.strategies = new EnumMap<>(InsertStrategyType.class);
    for (InsertStrategy strategy : strategies) {
      this.strategies.put(strategy.type(), strategy);
    }
  }

  /**
   * 役割: {@code region} をロックし、選択した戦略で {@code delta} を挿入して 1 回だけコミットする。
   *
   * @throws LockContentionException 別の実行がリージョンを保持している場合
   * @throws ProvisioningFailedException トランザクションの開始、実行、コミットのいずれかが失敗した場合
   */
  public InsertResult apply(String region, AddressDelta delta, InsertStrategyType type) {
    final InsertStrategy strategy = strategies.get(type);
    if (strategy == null) {
      throw new ConfigurationException("no insert strategy registered for " + type);
    }
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    try {
      final InsertResult result =
          transactionTemplate.execute(
              status -> {
                regionLock.acquire(region);
                return strategy.insert(region, delta, status);
              });
      logger.info(
          "provisioning insert committed region={} strategy={} inserted={} skipped={}",
          region,
          type,
          result.insertedCount(),
          result.skippedCount());
      return result;
    } catch (DataAccessException ex) {
      if (RegionLock.isLockContention(ex)) {
        throw new LockContentionException(region, ex);
      }
      throw new ProvisioningFailedException(
          "provisioning transaction for region " + region + " was rolled back", ex);
    } catch (TransactionException ex) {
      // 接続断による開始失敗やコミット失敗は DataAccessException ではない
      throw new ProvisioningFailedException(
          "provisioning transaction for region " + region + " could not be completed", ex);
    } catch (UncheckedIOException ex) {
      throw new ProvisioningFailedException(
          "provisioning script for region " + region + " could not be processed", ex);
    }
  }
}
