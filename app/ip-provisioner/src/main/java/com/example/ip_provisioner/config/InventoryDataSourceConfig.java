/*
 * どこで: ip-provisioner 設定
 * 何を: コマンドラインで選ばれた環境のインベントリ DataSource を構築する
 * なぜ: 接続先 DB と認証情報は CLI 解析後にしか決まらないため
 */
package com.example.ip_provisioner.config;

import com.example.ip_provisioner.cli.CliOptions;
import com.example.ip_provisioner.credentials.CredentialResolver;
import com.example.ip_provisioner.model.DatabaseCredentials;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration(proxyBeanMethods = false)
@Profile("!test")
public class InventoryDataSourceConfig {

  private static final Logger logger = LoggerFactory.getLogger(InventoryDataSourceConfig.class);
  private static final int MAX_POOL_SIZE = 2;

  @Bean
  DataSource inventoryDataSource(
      ProvisionerProperties properties, CliOptions options, CredentialResolver credentialResolver) {
    final EnvironmentProperties environment = properties.environment(options.environment());
    final DatabaseCredentials credentials =
        credentialResolver.resolve(options.environment(), options.dbRegion());
    logger.info(
        "inventory datasource env={} url={} user={}",
        options.environment(),
        environment.jdbcUrl(),
        credentials.username());
    final HikariDataSource dataSource = new HikariDataSource();
    dataSource.setPoolName("inventory");
    dataSource.setJdbcUrl(environment.jdbcUrl());
    dataSource.setUsername(credentials.username());
    dataSource.setPassword(credentials.password());
    dataSource.setMaximumPoolSize(MAX_POOL_SIZE);
    return dataSource;
  }
}
