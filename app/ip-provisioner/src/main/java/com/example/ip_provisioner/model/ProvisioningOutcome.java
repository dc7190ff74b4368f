package com.example.ip_provisioner.model;

import java.util.Optional;

public record ProvisioningOutcome(
    String region, long deltaSize, InsertResult result, Optional<BackupArtifact> backup, boolean cancelled) {

  public boolean rollbackAvailable() {
    return backup.isPresent();
  }
}
