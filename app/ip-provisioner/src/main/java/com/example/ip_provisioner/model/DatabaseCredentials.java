package com.example.ip_provisioner.model;

public record DatabaseCredentials(String username, String password) {

  @Override
  public String toString() {
    return "DatabaseCredentials[username=" + username + ", password=***]";
  }
}
