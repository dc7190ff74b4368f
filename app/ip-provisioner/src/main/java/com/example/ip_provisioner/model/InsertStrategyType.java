package com.example.ip_provisioner.model;

public enum InsertStrategyType {
  BULK,
  ROW
}
