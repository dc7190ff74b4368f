package com.example.ip_provisioner.model;

import java.nio.file.Path;

public record RollbackOutcome(Path path, String region, long rowsDeleted, long rowsRestored) {}
