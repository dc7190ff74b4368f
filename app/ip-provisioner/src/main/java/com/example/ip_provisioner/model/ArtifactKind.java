package com.example.ip_provisioner.model;

public enum ArtifactKind {
  /** 新規アドレスの insert-if-absent スクリプト。 */
  PROVISION,
  /** リージョン 1 つ分を削除して再挿入するスナップショット。 */
  RESTORE
}
