package com.example.ip_provisioner.service;

public class RegionNotFoundException extends ProvisioningException {

  private final String region;

  public RegionNotFoundException(String region) {
    super("region " + region + " not found in region catalog");
    this.region = region;
  }

  public String region() {
    return region;
  }

  @Override
  public Reason reason() {
    return Reason.REGION_NOT_FOUND;
  }
}
