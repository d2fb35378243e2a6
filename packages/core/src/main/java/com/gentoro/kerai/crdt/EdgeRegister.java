package com.gentoro.kerai.crdt;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKey;

/** Add-wins-if-newer register for one edge identity. */
final class EdgeRegister {
  private final EdgeKey key;
  private Operation lastAdd;
  private OpKey lastRemove;

  EdgeRegister(EdgeKey key) {
    this.key = key;
  }

  void add(Operation op) {
    if (op.getType() == OperationType.ADD_EDGE) {
      if (lastAdd == null || op.key().after(lastAdd.key())) lastAdd = op;
    } else if (op.key().after(lastRemove)) {
      lastRemove = op.key();
    }
  }

  boolean present() {
    return lastAdd != null && lastAdd.key().after(lastRemove);
  }

  Edge edge() {
    return present()
        ? new Edge(key.kind(), key.sourceId(), key.targetId(), lastAdd.payloadMap("metadata"))
        : null;
  }
}
