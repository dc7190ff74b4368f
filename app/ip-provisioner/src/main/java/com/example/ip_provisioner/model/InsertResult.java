package com.example.ip_provisioner.model;

public record InsertResult(InsertStrategyType strategy, long insertedCount, long skippedCount) {

  public static InsertResult empty(InsertStrategyType strategy) {
    return new InsertResult(strategy, 0, 0);
  }

  public long total() {
    return insertedCount + skippedCount;
  }
}
