package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.InsertResult;
import com.example.ip_provisioner.model.InsertStrategyType;
import org.springframework.transaction.TransactionStatus;

/**
 * 役割: 差分をインベントリへ書き込む。
 * 前提: 実装はリージョンロック取得済みのトランザクション内で動き、自らコミットしないこと。
 */
public interface InsertStrategy {

  InsertStrategyType type();

  InsertResult insert(String region, AddressDelta delta, TransactionStatus status);
}
