package com.gentoro.kerai.crdt;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** An operation before the log stamps it with an id, clock values and a signature. */
public record OperationDraft(OperationType type, String nodeId, Map<String, Object> payload) {
  public OperationDraft {
    Objects.requireNonNull(type, "type");
    payload = payload == null ? Map.of() : payload;
  }

  public static OperationDraft insert(Node node) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("kind", node.getKind());
    p.put("content", node.getContent());
    p.put("parent_id", node.getParentId());
    p.put("position", node.getPosition());
    p.put("metadata", new LinkedHashMap<>(node.getMetadata()));
    return new OperationDraft(OperationType.INSERT_NODE, node.getId(), p);
  }

  public static OperationDraft move(String nodeId, String parentId, long position) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("parent_id", parentId);
    p.put("position", position);
    return new OperationDraft(OperationType.MOVE_NODE, nodeId, p);
  }

  public static OperationDraft update(String nodeId, String content, Map<String, Object> metadata) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("content", content);
    p.put("metadata", metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
    return new OperationDraft(OperationType.UPDATE_CONTENT, nodeId, p);
  }

  public static OperationDraft delete(String nodeId) {
    return new OperationDraft(OperationType.DELETE_NODE, nodeId, Map.of());
  }

  public static OperationDraft addEdge(Edge edge) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("kind", edge.getKind());
    p.put("source", edge.getSourceId());
    p.put("target", edge.getTargetId());
    p.put("metadata", new LinkedHashMap<>(edge.getMetadata()));
    return new OperationDraft(OperationType.ADD_EDGE, null, p);
  }

  public static OperationDraft removeEdge(String kind, String sourceId, String targetId) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("kind", kind);
    p.put("source", sourceId);
    p.put("target", targetId);
    return new OperationDraft(OperationType.REMOVE_EDGE, null, p);
  }

  Operation stamp(String peerId, long seq, long lamport) {
    return new Operation(null, peerId, seq, lamport, type, nodeId, payload, null);
  }
}
