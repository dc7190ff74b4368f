package com.example.ip_provisioner.service;

/** 役割: 取り消せない処理の前に運用者へ yes/no を確認する。 */
public interface OperatorPrompt {

  boolean confirm(String question);
}
