package com.example.ip_provisioner.model;

public enum ExecutionMode {
  BLOCKING,
  EVENT_LOOP
}
