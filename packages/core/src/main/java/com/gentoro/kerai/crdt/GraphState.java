package com.gentoro.kerai.crdt;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKey;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import com.gentoro.kerai.logging.LoggingService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * The graph materialized from a set of operations.
 *
 * <p>Applying an operation whose id was already applied is a no-op, and the materialized graph is
 * independent of the order operations arrive in. Not thread-safe; stores serialize access.
 */
public final class GraphState {
  private static final Logger log = LoggingService.getLogger(GraphState.class);

  public static final Comparator<Node> SIBLING_ORDER =
      Comparator.comparingLong(Node::getPosition).thenComparing(Node::getId);

  private final Map<String, NodeRegister> nodes = new HashMap<>();
  private final Map<EdgeKey, EdgeRegister> edges = new HashMap<>();
  private final Map<String, Set<String>> childrenByParent = new HashMap<>();
  private final Map<String, String> parentOf = new HashMap<>();
  private final Map<String, Set<EdgeKey>> edgesByNode = new HashMap<>();
  private final Set<String> applied = new HashSet<>();
  private final List<Operation> operations = new ArrayList<>();
  private final VersionVector versions = new VersionVector();
  private long maxLamport;

  /**
   * Apply one operation.
   *
   * @return {@code false} when the operation id was already applied
   */
  public boolean apply(Operation op) {
    if (!applied.add(op.getId())) {
      log.trace("Ignoring re-delivered operation {}", op.getId());
      return false;
    }
    operations.add(op);
    versions.observe(op.getPeerId(), op.getSeq());
    maxLamport = Math.max(maxLamport, op.getLamport());

    if (op.getType().targetsEdge()) {
      EdgeKey key =
          new EdgeKey(
              op.payloadString("kind"), op.payloadString("source"), op.payloadString("target"));
      edges.computeIfAbsent(key, EdgeRegister::new).add(op);
      edgesByNode.computeIfAbsent(key.sourceId(), k -> new LinkedHashSet<>()).add(key);
      edgesByNode.computeIfAbsent(key.targetId(), k -> new LinkedHashSet<>()).add(key);
      return true;
    }

    NodeRegister register = nodes.computeIfAbsent(op.getNodeId(), NodeRegister::new);
    NodeStatus before = register.status();
    register.add(op);
    if (!before.isLive()
        && (op.getType() == OperationType.UPDATE_CONTENT
            || op.getType() == OperationType.MOVE_NODE)) {
      log.info(
          "Operation {} targets {} node {}; recorded without a visible node",
          op.getId(),
          before == NodeStatus.ABSENT ? "unknown" : "tombstoned",
          op.getNodeId());
    }
    reindex(op.getNodeId(), register.node());
    return true;
  }

  public boolean contains(String operationId) {
    return applied.contains(operationId);
  }

  private void reindex(String id, Node node) {
    String oldParent = parentOf.remove(id);
    if (oldParent != null) {
      Set<String> siblings = childrenByParent.get(oldParent);
      if (siblings != null) siblings.remove(id);
    }
    if (node != null && node.getParentId() != null) {
      parentOf.put(id, node.getParentId());
      childrenByParent.computeIfAbsent(node.getParentId(), k -> new HashSet<>()).add(id);
    }
  }

  public Optional<Node> node(String id) {
    NodeRegister r = nodes.get(id);
    return Optional.ofNullable(r == null ? null : r.node());
  }

  public NodeStatus status(String id) {
    NodeRegister r = nodes.get(id);
    return r == null ? NodeStatus.ABSENT : r.status();
  }

  /** Metadata of the newest insert or edit, also for tombstones. */
  public Map<String, Object> lastSeenMetadata(String id) {
    NodeRegister r = nodes.get(id);
    return r == null ? Collections.emptyMap() : r.lastSeenMetadata();
  }

  /** Live children of {@code parentId} in sibling order. */
  public List<Node> children(String parentId) {
    Set<String> ids = childrenByParent.getOrDefault(parentId, Collections.emptySet());
    return ids.stream()
        .map(nodes::get)
        .map(NodeRegister::node)
        .filter(n -> n != null)
        .sorted(SIBLING_ORDER)
        .collect(Collectors.toList());
  }

  public List<Node> liveNodes() {
    return nodes.values().stream()
        .map(NodeRegister::node)
        .filter(n -> n != null)
        .sorted(Comparator.comparing(Node::getId))
        .collect(Collectors.toList());
  }

  /** Present edges touching {@code nodeId} as source or target, optionally of one kind. */
  public List<Edge> edges(String nodeId, String kind) {
    return edgesByNode.getOrDefault(nodeId, Collections.emptySet()).stream()
        .filter(k -> kind == null || kind.equals(k.kind()))
        .map(edges::get)
        .map(EdgeRegister::edge)
        .filter(e -> e != null)
        .collect(Collectors.toList());
  }

  public List<Edge> allEdges() {
    return edges.values().stream()
        .map(EdgeRegister::edge)
        .filter(e -> e != null)
        .collect(Collectors.toList());
  }

  /** Operations from {@code peerId} with a sequence number above {@code cursor}, by sequence. */
  public List<Operation> operationsSince(String peerId, long cursor) {
    return operations.stream()
        .filter(op -> op.getPeerId().equals(peerId) && op.getSeq() > cursor)
        .sorted(Comparator.comparingLong(Operation::getSeq))
        .collect(Collectors.toList());
  }

  public List<Operation> operations() {
    return Collections.unmodifiableList(operations);
  }

  public VersionVector versionVector() {
    return versions;
  }

  public long maxLamport() {
    return maxLamport;
  }
}
