package com.example.ip_provisioner.service;

import java.nio.file.Path;

public class BackupNotFoundException extends ProvisioningException {

  private final Path path;

  public BackupNotFoundException(Path path) {
    super("backup artifact not found: " + path);
    this.path = path;
  }

  public Path path() {
    return path;
  }

  @Override
  public Reason reason() {
    return Reason.BACKUP_NOT_FOUND;
  }
}
