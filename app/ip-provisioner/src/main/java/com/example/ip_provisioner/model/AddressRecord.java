package com.example.ip_provisioner.model;

import java.time.Instant;

public record AddressRecord(String region, long address, Instant timestamp, boolean inuse) {

  /** 割り当て時刻が「不明」であることを表す保存値。 */
  public static final Instant UNKNOWN_ALLOCATION_TIME = Instant.EPOCH;

  public static AddressRecord unallocated(String region, long address) {
    return new AddressRecord(region, address, UNKNOWN_ALLOCATION_TIME, false);
  }
}
