package com.example.ip_provisioner.credentials;

import com.example.ip_provisioner.config.EnvironmentProperties;
import com.example.ip_provisioner.config.ProvisionerProperties;
import com.example.ip_provisioner.model.DatabaseCredentials;
import com.example.ip_provisioner.service.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** 役割: local 環境は設定済みのログイン情報を使い、それ以外はプロバイダに問い合わせる。 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

  private static final Logger logger = LoggerFactory.getLogger(CredentialResolver.class);

  private final ProvisionerProperties properties;
  private final CredentialProvider credentialProvider;

  public DatabaseCredentials resolve(String environmentName, String dbRegion) {
    final EnvironmentProperties environment = properties.environment(environmentName);
    if (environment.local()) {
      if (environment.username() == null || environment.username().isBlank()) {
        throw new ConfigurationException(
            "local environment " + environmentName + " has no username configured");
      }
      logger.debug("using configured credentials env={}", environmentName);
      return new DatabaseCredentials(environment.username(), environment.password());
    }
    return credentialProvider.credentials(environmentName, environment, dbRegion);
  }
}
