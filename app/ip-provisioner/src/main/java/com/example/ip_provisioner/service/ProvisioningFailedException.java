package com.example.ip_provisioner.service;

public class ProvisioningFailedException extends ProvisioningException {

  public ProvisioningFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Reason reason() {
    return Reason.PROVISIONING_FAILED;
  }
}
