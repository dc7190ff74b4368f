/*
 * どこで: プロビジョニングのサービス層
 * 何を: CLI が個別の終了コードで報告する失敗の基底クラス
 * なぜ: 文字列照合なしで理由をプロセス終了コードへ対応付けるため
 */
package com.example.ip_provisioner.service;

public abstract class ProvisioningException extends RuntimeException {

  public enum Reason {
    CONFIGURATION,
    REGION_NOT_FOUND,
    CREDENTIALS,
    LOCK_CONTENTION,
    BACKUP_NOT_FOUND,
    ROLLBACK_FAILED,
    PROVISIONING_FAILED
  }

  protected ProvisioningException(String message) {
    super(message);
  }

  protected ProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract Reason reason();
}
