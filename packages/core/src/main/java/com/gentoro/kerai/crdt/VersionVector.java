package com.gentoro.kerai.crdt;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per peer, the highest sequence number up to which every operation has been seen.
 *
 * <p>Operations that arrive ahead of a gap are remembered and fold into the watermark once the
 * gap closes, so the value is always safe to use as a replication cursor.
 */
public final class VersionVector {
  private final Map<String, Long> watermarks = new TreeMap<>();
  private final Map<String, NavigableSet<Long>> ahead = new HashMap<>();

  public void observe(String peerId, long seq) {
    long mark = watermarks.getOrDefault(peerId, 0L);
    if (seq <= mark) return;
    NavigableSet<Long> pending = ahead.computeIfAbsent(peerId, k -> new TreeSet<>());
    pending.add(seq);
    while (!pending.isEmpty() && pending.first() == mark + 1) {
      mark = pending.pollFirst();
    }
    watermarks.put(peerId, mark);
  }

  public long get(String peerId) {
    return watermarks.getOrDefault(peerId, 0L);
  }

  /** Highest sequence number seen from {@code peerId}, gaps or not. */
  public long highest(String peerId) {
    NavigableSet<Long> pending = ahead.get(peerId);
    long mark = get(peerId);
    return pending == null || pending.isEmpty() ? mark : Math.max(mark, pending.last());
  }

  public Map<String, Long> asMap() {
    return Collections.unmodifiableMap(new TreeMap<>(watermarks));
  }

  @Override
  public String toString() {
    return watermarks.toString();
  }
}
