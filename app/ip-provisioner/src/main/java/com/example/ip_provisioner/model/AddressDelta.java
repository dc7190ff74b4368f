/*
 * どこで: プロビジョニングのドメインモデル
 * 何を: 拡張レンジのうち現行レンジに含まれないアドレスを順序付きで表す
 * なぜ: /8 の拡張では数百万行になるため、アドレスを必要時に生成する
 */
package com.example.ip_provisioner.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.LongStream;

public final class AddressDelta implements Iterable<Long> {

  private final NetworkRange expanded;
  private final NetworkRange current;
  private final List<Span> spans;

  private AddressDelta(NetworkRange expanded, NetworkRange current, List<Span> spans) {
    this.expanded = expanded;
    this.current = current;
    this.spans = List.copyOf(spans);
  }

  public static AddressDelta between(
      NetworkRange expanded, NetworkRange current, boolean includeBroadcast) {
    final List<Span> spans = new ArrayList<>();
    addIfNotEmpty(spans, expanded.firstHost(), Math.min(expanded.lastHost(), current.firstHost() - 1));
    addIfNotEmpty(spans, Math.max(expanded.firstHost(), current.lastHost() + 1), expanded.lastHost());
    final long broadcast = expanded.broadcastAddress();
    // 同一レンジは拡張ではないため、ブロードキャストも追加しない
    if (includeBroadcast
        && expanded.prefixLength() < current.prefixLength()
        && !expanded.isHost(broadcast)
        && !current.isHost(broadcast)) {
      spans.add(new Span(broadcast, broadcast));
    }
    return new AddressDelta(expanded, current, spans);
  }

  public NetworkRange expanded() {
    return expanded;
  }

  public NetworkRange current() {
    return current;
  }

  public long size() {
    return spans.stream().mapToLong(Span::length).sum();
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  public OptionalLong first() {
    return spans.isEmpty() ? OptionalLong.empty() : OptionalLong.of(spans.get(0).first());
  }

  public OptionalLong last() {
    return spans.isEmpty()
        ? OptionalLong.empty()
        : OptionalLong.of(spans.get(spans.size() - 1).last());
  }

  /** 呼び出すたびに差分の先頭から走査し直す。 */
  public LongStream stream() {
    return spans.stream().flatMapToLong(span -> LongStream.rangeClosed(span.first(), span.last()));
  }

  @Override
  public Iterator<Long> iterator() {
    return stream().iterator();
  }

  private static void addIfNotEmpty(List<Span> spans, long first, long last) {
    if (first <= last) {
      spans.add(new Span(first, last));
    }
  }

  private record Span(long first, long last) {
    long length() {
      return last - first + 1;
    }
  }
}
