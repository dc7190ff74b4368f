package com.example.ip_provisioner.config;

import com.example.ip_provisioner.credentials.SecretsManagerClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

@Configuration(proxyBeanMethods = false)
public class SecretsManagerConfig {

  @Bean
  SecretsManagerClientFactory secretsManagerClientFactory() {
    // CLI は 1 回の実行でシークレットを 1 つだけ読むため、取得ごとに短命のクライアントを作る
    return (profile, region) ->
        SecretsManagerClient.builder()
            .region(Region.of(region))
            .credentialsProvider(ProfileCredentialsProvider.create(profile))
            .build();
  }
}
