/*
 * どこで: プロビジョニングのドメインモデル
 * 何を: 不変の IPv4 CIDR ブロックとそのホスト範囲を表す
 * なぜ: インベントリに保存される 32bit 整数表現のままレンジ計算を行うため
 */
package com.example.ip_provisioner.model;

import com.google.common.net.InetAddresses;
import java.net.Inet4Address;
import java.net.InetAddress;

public record NetworkRange(long networkAddress, int prefixLength) {

  private static final int ADDRESS_BITS = 32;
  private static final long ADDRESS_MASK = 0xFFFF_FFFFL;

  public NetworkRange {
    if (prefixLength < 0 || prefixLength > ADDRESS_BITS) {
      throw new IllegalArgumentException("prefix length must be between 0 and 32: " + prefixLength);
    }
    if (networkAddress < 0 || networkAddress > ADDRESS_MASK) {
      throw new IllegalArgumentException("not a 32-bit address: " + networkAddress);
    }
    if ((networkAddress & ~maskFor(prefixLength) & ADDRESS_MASK) != 0) {
      throw new IllegalArgumentException(
          formatAddress(networkAddress) + "/" + prefixLength + " has host bits set");
    }
  }

  public static NetworkRange parse(String cidr) {
    if (cidr == null || cidr.isBlank()) {
      throw new IllegalArgumentException("CIDR range is required");
    }
    final String trimmed = cidr.trim();
    final int slash = trimmed.indexOf('/');
    if (slash < 0) {
      throw new IllegalArgumentException("CIDR range must contain a prefix length: " + trimmed);
    }
    final String addressPart = trimmed.substring(0, slash);
    final String prefixPart = trimmed.substring(slash + 1);
    if (!InetAddresses.isInetAddress(addressPart)) {
      throw new IllegalArgumentException("invalid network address: " + addressPart);
    }
    final InetAddress address = InetAddresses.forString(addressPart);
    if (!(address instanceof Inet4Address)) {
      throw new IllegalArgumentException("only IPv4 ranges are supported: " + trimmed);
    }
    final int prefix;
    try {
      prefix = Integer.parseInt(prefixPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid prefix length: " + prefixPart, ex);
    }
    return new NetworkRange(Integer.toUnsignedLong(InetAddresses.coerceToInteger(address)), prefix);
  }

  public static String formatAddress(long address) {
    return InetAddresses.fromInteger((int) address).getHostAddress();
  }

  public long size() {
    return 1L << (ADDRESS_BITS - prefixLength);
  }

  public long lastAddress() {
    return networkAddress + size() - 1;
  }

  public long broadcastAddress() {
    return lastAddress();
  }

  // /31 と /32 にはネットワーク/ブロードキャストの予約アドレスがない
  public long firstHost() {
    return prefixLength >= ADDRESS_BITS - 1 ? networkAddress : networkAddress + 1;
  }

  public long lastHost() {
    return prefixLength >= ADDRESS_BITS - 1 ? lastAddress() : lastAddress() - 1;
  }

  public long hostCount() {
    return lastHost() - firstHost() + 1;
  }

  public boolean isHost(long address) {
    return address >= firstHost() && address <= lastHost();
  }

  public boolean contains(NetworkRange other) {
    return prefixLength <= other.prefixLength
        && (other.networkAddress & maskFor(prefixLength)) == networkAddress;
  }

  @Override
  public String toString() {
    return formatAddress(networkAddress) + "/" + prefixLength;
  }

  private static long maskFor(int prefixLength) {
    return prefixLength == 0 ? 0L : (ADDRESS_MASK << (ADDRESS_BITS - prefixLength)) & ADDRESS_MASK;
  }
}
