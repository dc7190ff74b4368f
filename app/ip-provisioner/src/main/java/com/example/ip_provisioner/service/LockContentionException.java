package com.example.ip_provisioner.service;

public class LockContentionException extends ProvisioningException {

  private final String region;

  public LockContentionException(String region, Throwable cause) {
    super("region " + region + " is locked by another provisioning run", cause);
    this.region = region;
  }

  public String region() {
    return region;
  }

  @Override
  public Reason reason() {
    return Reason.LOCK_CONTENTION;
  }
}
