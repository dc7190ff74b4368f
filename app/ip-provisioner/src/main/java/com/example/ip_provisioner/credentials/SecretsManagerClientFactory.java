package com.example.ip_provisioner.credentials;

import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

@FunctionalInterface
public interface SecretsManagerClientFactory {

  SecretsManagerClient create(String profile, String region);
}
