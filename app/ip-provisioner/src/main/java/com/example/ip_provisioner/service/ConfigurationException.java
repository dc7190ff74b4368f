package com.example.ip_provisioner.service;

public class ConfigurationException extends ProvisioningException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Reason reason() {
    return Reason.CONFIGURATION;
  }
}
