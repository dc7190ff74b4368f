package com.example.ip_provisioner.service;

public class CredentialsException extends ProvisioningException {

  public CredentialsException(String message) {
    super(message);
  }

  public CredentialsException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Reason reason() {
    return Reason.CREDENTIALS;
  }
}
