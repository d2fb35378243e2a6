package com.gentoro.kerai.crdt;

import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Every operation ever applied to one node id, and the state they resolve to.
 *
 * <p>The resolved state depends only on the set of operations, never on arrival order:
 *
 * <ul>
 *   <li>the latest {@code delete_node} wins over every insert, edit or move with a smaller key;
 *   <li>the node is live when some insert is newer than that delete;
 *   <li>content and metadata come from the newest of that insert and the later edits;
 *   <li>parent and position come from the newest of that insert and the later moves.
 * </ul>
 */
final class NodeRegister {
  private final String nodeId;
  private final List<Operation> ops = new ArrayList<>();

  private Node node;
  private NodeStatus status = NodeStatus.ABSENT;
  private Map<String, Object> lastSeenMetadata = Collections.emptyMap();

  NodeRegister(String nodeId) {
    this.nodeId = nodeId;
  }

  void add(Operation op) {
    ops.add(op);
    resolve();
  }

  Node node() {
    return node;
  }

  NodeStatus status() {
    return status;
  }

  Map<String, Object> lastSeenMetadata() {
    return lastSeenMetadata;
  }

  private void resolve() {
    OpKey deleted = null;
    for (Operation op : ops) {
      if (op.getType() == OperationType.DELETE_NODE && op.key().after(deleted)) deleted = op.key();
    }

    Operation insert = null;
    Operation lastSeen = null;
    boolean anyInsert = false;
    for (Operation op : ops) {
      if (op.getType() == OperationType.INSERT_NODE) {
        anyInsert = true;
        if (op.key().after(deleted) && (insert == null || op.key().after(insert.key()))) {
          insert = op;
        }
      }
      if (carriesContent(op) && (lastSeen == null || op.key().after(lastSeen.key()))) {
        lastSeen = op;
      }
    }
    if (lastSeen != null) lastSeenMetadata = lastSeen.payloadMap("metadata");

    if (insert == null) {
      node = null;
      status = deleted != null || anyInsert ? NodeStatus.TOMBSTONED : NodeStatus.ABSENT;
      return;
    }

    Operation content = insert;
    Operation placement = insert;
    for (Operation op : ops) {
      if (!op.key().after(deleted)) continue;
      if (op.getType() == OperationType.UPDATE_CONTENT && op.key().after(content.key())) {
        content = op;
      } else if (op.getType() == OperationType.MOVE_NODE && op.key().after(placement.key())) {
        placement = op;
      }
    }
    node =
        new Node(
            nodeId,
            insert.payloadString("kind"),
            content.payloadString("content"),
            placement.payloadString("parent_id"),
            placement.payloadLong("position"),
            content.payloadMap("metadata"));
    status = content == insert ? NodeStatus.PRESENT : NodeStatus.EDITED;
  }

  private static boolean carriesContent(Operation op) {
    return op.getType() == OperationType.INSERT_NODE
        || op.getType() == OperationType.UPDATE_CONTENT;
  }
}
