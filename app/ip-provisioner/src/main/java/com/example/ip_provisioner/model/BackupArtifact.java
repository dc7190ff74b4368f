package com.example.ip_provisioner.model;

import java.nio.file.Path;
import java.time.Instant;

public record BackupArtifact(Path path, String region, Instant capturedAt, long recordCount) {}
