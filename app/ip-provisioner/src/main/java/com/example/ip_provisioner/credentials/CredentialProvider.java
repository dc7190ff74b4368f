package com.example.ip_provisioner.credentials;

import com.example.ip_provisioner.config.EnvironmentProperties;
import com.example.ip_provisioner.model.DatabaseCredentials;

/** 役割: local 以外の環境のインベントリ DB ログイン情報を取得する。 */
public interface CredentialProvider {

  /**
   * @throws com.example.ip_provisioner.service.CredentialsException ログイン情報を取得できない、
   *     または形式が不正な場合
   */
  DatabaseCredentials credentials(
      String environmentName, EnvironmentProperties environment, String dbRegion);
}
