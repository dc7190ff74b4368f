package com.example.ip_provisioner.cli;

import com.example.ip_provisioner.service.ProvisioningException;

/** プロビジョニング CLI のプロセス終了コード。 */
public enum ExitCode {
  SUCCESS(0),
  UNEXPECTED(1),
  CONFIGURATION(2),
  REGION_NOT_FOUND(3),
  CREDENTIALS(4),
  LOCK_CONTENTION(5),
  BACKUP_NOT_FOUND(6),
  ROLLBACK_FAILED(7),
  PROVISIONING_FAILED(8),
  CANCELLED(9);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ExitCode of(ProvisioningException.Reason reason) {
    return switch (reason) {
      case CONFIGURATION -> CONFIGURATION;
      case REGION_NOT_FOUND -> REGION_NOT_FOUND;
      case CREDENTIALS -> CREDENTIALS;
      case LOCK_CONTENTION -> LOCK_CONTENTION;
      case BACKUP_NOT_FOUND -> BACKUP_NOT_FOUND;
      case ROLLBACK_FAILED -> ROLLBACK_FAILED;
      case PROVISIONING_FAILED -> PROVISIONING_FAILED;
    };
  }

  /**
   * 役割: cause チェーン上の最初の {@link ProvisioningException} を対応付ける。
   * 見つからなければ {@link #UNEXPECTED} を返す。
   */
  public static ExitCode of(Throwable failure) {
    for (Throwable current = failure; current != null; current = current.getCause()) {
      if (current instanceof ProvisioningException provisioningException) {
        return of(provisioningException.reason());
      }
    }
    return UNEXPECTED;
  }
}
