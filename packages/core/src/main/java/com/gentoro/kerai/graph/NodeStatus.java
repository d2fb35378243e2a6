package com.gentoro.kerai.graph;

/** Lifecycle of a node id in the replicated graph. */
public enum NodeStatus {
  /** Never inserted, as far as this replica knows. */
  ABSENT,
  PRESENT,
  /** Present, and its content was changed after the winning insert. */
  EDITED,
  /** Deleted. Content is gone; last-seen metadata is retained. */
  TOMBSTONED;

  public boolean isLive() {
    return this == PRESENT || this == EDITED;
  }
}
