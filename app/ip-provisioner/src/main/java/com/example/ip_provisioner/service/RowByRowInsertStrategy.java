/*
 * どこで: プロビジョニングのサービス層
 * 何を: 差分を 1 アドレスずつ、行ごとにセーブポイントを挟んで挿入する
 * なぜ: 不正な行はトランザクション全体を中断せずにスキップして数えるため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.AddressRecord;
import com.example.ip_provisioner.model.InsertResult;
import com.example.ip_provisioner.model.InsertStrategyType;
import com.example.ip_provisioner.model.NetworkRange;
import com.example.ip_provisioner.repository.AddressRepository;
import com.google.common.annotations.VisibleForTesting;
import java.util.PrimitiveIterator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionStatus;

@Component
@RequiredArgsConstructor
public class RowByRowInsertStrategy implements InsertStrategy {

  private static final Logger logger = LoggerFactory.getLogger(RowByRowInsertStrategy.class);

  private final AddressRepository addressRepository;
  private final ProvisionerProperties properties;

  @Override
  public InsertStrategyType type() {
    return InsertStrategyType.ROW;
  }

  @Override
  public InsertResult insert(String region, AddressDelta delta, TransactionStatus status) {
    final long total = delta.size();
    final int progressInterval = properties.progressInterval();
    long inserted = 0;
    long skipped = 0;
    long processed = 0;
    final PrimitiveIterator.OfLong addresses = delta.stream().iterator();
    while (addresses.hasNext()) {
      final long address = addresses.nextLong();
      if (insertOne(region, address, status)) {
        inserted++;
      } else {
        skipped++;
      }
      processed++;
      if (processed % progressInterval == 0) {
        logger.info(
            "row insert progress region={} processed={} total={} inserted={} skipped={}",
            region,
            processed,
            total,
            inserted,
            skipped);
      }
    }
    logger.info("row insert completed region={} inserted={} skipped={}", region, inserted, skipped);
    return new InsertResult(type(), inserted, skipped);
  }

  private boolean insertOne(String region, long address, TransactionStatus status) {
    final Object savepoint = status.createSavepoint();
    try {
      final int created = addressRepository.insertIfAbsent(AddressRecord.unallocated(region, address));
      status.releaseSavepoint(savepoint);
      return created > 0;
    } catch (DataAccessException ex) {
      if (isFatal(ex)) {
        throw ex;
      }
      status.rollbackToSavepoint(savepoint);
      status.releaseSavepoint(savepoint);
      logger.debug(
          "row insert skipped region={} address={} cause={}",
          region,
          NetworkRange.formatAddress(address),
          ex.getMessage());
      return false;
    }
  }

  @VisibleForTesting
  static boolean isFatal(DataAccessException ex) {
    return ex instanceof DataAccessResourceFailureException
        || ex instanceof TransientDataAccessResourceException
        || ex instanceof PessimisticLockingFailureException;
  }
}
