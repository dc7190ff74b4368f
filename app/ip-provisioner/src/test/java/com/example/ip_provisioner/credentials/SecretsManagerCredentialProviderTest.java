package com.example.ip_provisioner.credentials;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.ip_provisioner.config.EnvironmentProperties;
import com.example.ip_provisioner.model.DatabaseCredentials;
import com.example.ip_provisioner.service.ConfigurationException;
import com.example.ip_provisioner.service.CredentialsException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

class SecretsManagerCredentialProviderTest {

  private static final EnvironmentProperties DEV =
      new EnvironmentProperties("devdb.internal", 5432, "devdb", false, null, null, null, null);

  private final SecretsManagerClient client = mock(SecretsManagerClient.class);
  private final SecretsManagerClientFactory factory = mock(SecretsManagerClientFactory.class);
  private SecretsManagerCredentialProvider provider;

  @BeforeEach
  void setUp() {
    when(factory.create(any(), any())).thenReturn(client);
    provider = new SecretsManagerCredentialProvider(factory, new ObjectMapper());
  }

  private void secretString(String value) {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(GetSecretValueResponse.builder().secretString(value).build());
  }

  @Test
  void readsConventionalSecretWithEnvironmentProfile() {
    secretString("{\"ipam_app\": \"s3cr3t\"}");

    final DatabaseCredentials credentials = provider.credentials("dev", DEV, "eu-west-1");

    assertThat(credentials).isEqualTo(new DatabaseCredentials("ipam_app", "s3cr3t"));
    assertThat(credentials.toString()).doesNotContain("s3cr3t");
    verify(factory).create("nataas-dev", "eu-west-1");
    final ArgumentCaptor<GetSecretValueRequest> request =
        ArgumentCaptor.forClass(GetSecretValueRequest.class);
    verify(client).getSecretValue(request.capture());
    assertThat(request.getValue().secretId()).isEqualTo("dev/api/rds");
    verify(client).close();
  }

  @Test
  void configuredSecretNameAndProfileWin() {
    final EnvironmentProperties custom =
        new EnvironmentProperties("db", 5432, "db", false, null, null, "custom/secret", "ops");

    assertThat(SecretsManagerCredentialProvider.secretName("dev", custom)).isEqualTo("custom/secret");
    assertThat(SecretsManagerCredentialProvider.profile("dev", custom)).isEqualTo("ops");
  }

  @Test
  void rejectsSecretsThatAreNotASingleStringEntry() {
    for (String malformed :
        new String[] {
          "{}",
          "{\"a\": \"1\", \"b\": \"2\"}",
          "{\"a\": 1}",
          "[\"a\"]",
          "__import__('os').system('id')",
          ""
        }) {
      assertThatThrownBy(() -> provider.parse("dev/api/rds", malformed))
          .as(malformed)
          .isInstanceOf(CredentialsException.class);
    }
  }

  @Test
  void missingSecretIsACredentialsError() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("not found").build());

    assertThatThrownBy(() -> provider.credentials("dev", DEV, "eu-west-1"))
        .isInstanceOf(CredentialsException.class)
        .hasMessageContaining("dev/api/rds");
  }

  @Test
  void unreachableProviderIsACredentialsError() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenThrow(SdkClientException.create("unable to load profile"));

    assertThatThrownBy(() -> provider.credentials("dev", DEV, "eu-west-1"))
        .isInstanceOf(CredentialsException.class);
  }

  @Test
  void dbRegionIsRequired() {
    assertThatThrownBy(() -> provider.credentials("dev", DEV, " "))
        .isInstanceOf(ConfigurationException.class);
    verifyNoInteractions(factory);
  }
}
