/*
 * どこで: ip-provisioner 認証情報
 * 何を: インベントリ DB のログイン情報を AWS Secrets Manager から取得する
 * なぜ: local 以外の環境では DB パスワードを設定ファイルに置かないため
 */
package com.example.ip_provisioner.credentials;

import com.example.ip_provisioner.config.EnvironmentProperties;
import com.example.ip_provisioner.model.DatabaseCredentials;
import com.example.ip_provisioner.service.ConfigurationException;
import com.example.ip_provisioner.service.CredentialsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

@Component
@RequiredArgsConstructor
public class SecretsManagerCredentialProvider implements CredentialProvider {

  private static final Logger logger =
      LoggerFactory.getLogger(SecretsManagerCredentialProvider.class);

  private final SecretsManagerClientFactory clientFactory;
  private final ObjectMapper objectMapper;

  @Override
  public DatabaseCredentials credentials(
      String environmentName, EnvironmentProperties environment, String dbRegion) {
    if (dbRegion == null || dbRegion.isBlank()) {
      throw new ConfigurationException("--db_region is required for environment " + environmentName);
    }
    final String secretName = secretName(environmentName, environment);
    final String profile = profile(environmentName, environment);
    logger.info("fetching database secret name={} profile={} region={}", secretName, profile, dbRegion);
    final String secretString;
    try (SecretsManagerClient client = clientFactory.create(profile, dbRegion)) {
      secretString =
          client
              .getSecretValue(GetSecretValueRequest.builder().secretId(secretName).build())
              .secretString();
    } catch (ResourceNotFoundException ex) {
      throw new CredentialsException("secret " + secretName + " does not exist in " + dbRegion, ex);
    } catch (SdkException ex) {
      throw new CredentialsException("failed to read secret " + secretName + ": " + ex.getMessage(), ex);
    }
    return parse(secretName, secretString);
  }

  static String secretName(String environmentName, EnvironmentProperties environment) {
    final String configured = environment.secretName();
    return configured == null || configured.isBlank() ? environmentName + "/api/rds" : configured;
  }

  static String profile(String environmentName, EnvironmentProperties environment) {
    final String configured = environment.awsProfile();
    return configured == null || configured.isBlank() ? "nataas-" + environmentName : configured;
  }

  /** 前提: 値は厳密に {@code {"<username>": "<password>"}} の形であること。 */
  DatabaseCredentials parse(String secretName, String secretString) {
    if (secretString == null || secretString.isBlank()) {
      throw new CredentialsException("secret " + secretName + " has no string value");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(secretString);
    } catch (JsonProcessingException ex) {
      // メッセージにシークレットが含まれ得るため伝播させない
      throw new CredentialsException("secret " + secretName + " is not valid JSON");
    }
    if (root == null || !root.isObject() || root.size() != 1) {
      throw new CredentialsException(
          "secret " + secretName + " must be a JSON object with exactly one entry");
    }
    final Map.Entry<String, JsonNode> entry = root.fields().next();
    if (!entry.getValue().isTextual() || entry.getKey().isBlank()) {
      throw new CredentialsException(
          "secret " + secretName + " must map a username to a string password");
    }
    return new DatabaseCredentials(entry.getKey(), entry.getValue().textValue());
  }
}
