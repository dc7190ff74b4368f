package com.example.ip_provisioner.service;

import java.nio.file.Path;

public class RollbackFailedException extends ProvisioningException {

  private final Path path;

  public RollbackFailedException(Path path, String detail, Throwable cause) {
    super(
        "rollback from "
            + path
            + " failed ("
            + detail
            + "); the region may be in an indeterminate state and needs manual intervention",
        cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }

  @Override
  public Reason reason() {
    return Reason.ROLLBACK_FAILED;
  }
}
