package com.gentoro.kerai.crdt;

import java.util.Comparator;

/**
 * Total order used for last-writer-wins: Lamport time, then peer id, then the peer's sequence
 * number. Two distinct operations never compare equal.
 */
public record OpKey(long lamport, String peerId, long seq) implements Comparable<OpKey> {
  private static final Comparator<OpKey> ORDER =
      Comparator.comparingLong(OpKey::lamport)
          .thenComparing(OpKey::peerId)
          .thenComparingLong(OpKey::seq);

  @Override
  public int compareTo(OpKey other) {
    return ORDER.compare(this, other);
  }

  public boolean after(OpKey other) {
    return other == null || compareTo(other) > 0;
  }
}
