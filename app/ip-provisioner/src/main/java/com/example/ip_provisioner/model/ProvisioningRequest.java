package com.example.ip_provisioner.model;

import java.nio.file.Path;

public record ProvisioningRequest(
    String region,
    NetworkRange expandedRange,
    NetworkRange currentRange,
    boolean includeBroadcast,
    InsertStrategyType strategy,
    Path backupDir,
    boolean force) {}
