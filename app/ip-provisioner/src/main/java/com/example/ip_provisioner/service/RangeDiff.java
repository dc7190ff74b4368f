/*
 * どこで: プロビジョニングのサービス層
 * 何を: 拡張によってリージョンに追加されるホストアドレスを算出する
 * なぜ: 現行レンジ外のアドレスだけをプロビジョニング対象とするため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.AddressDelta;
import com.example.ip_provisioner.model.NetworkRange;
import org.springframework.stereotype.Component;

@Component
public class RangeDiff {

  public AddressDelta compute(String expandedCidr, String currentCidr, boolean includeBroadcast) {
    return compute(
        parseRange(expandedCidr, "expanded"), parseRange(currentCidr, "current"), includeBroadcast);
  }

  /**
   * 役割: {@code expanded} のホストのうち {@code current} のホストでないものを返す。
   *
   * @throws ConfigurationException {@code expanded} が {@code current} を包含しない場合
   */
  public AddressDelta compute(
      NetworkRange expanded, NetworkRange current, boolean includeBroadcast) {
    if (!expanded.contains(current)) {
      throw new ConfigurationException(
          "expanded range " + expanded + " does not contain current range " + current);
    }
    return AddressDelta.between(expanded, current, includeBroadcast);
  }

  public static NetworkRange parseRange(String cidr, String label) {
    try {
      return NetworkRange.parse(cidr);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("invalid " + label + " range: " + ex.getMessage(), ex);
    }
  }
}
