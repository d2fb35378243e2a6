package com.gentoro.kerai.store;

import com.gentoro.kerai.crdt.Operation;
import com.gentoro.kerai.exception.StoreException;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable home of nodes, edges and the operation log.
 *
 * <p>Every read returns the graph as materialized from the operations applied so far. Any method
 * may throw {@link StoreException} when the backend is unavailable; callers decide whether to
 * retry.
 */
public interface GraphStore extends AutoCloseable {

  /** Open connections or replay persisted state. Idempotent. */
  void initialize();

  /**
   * Apply a batch all-or-nothing. Operations whose id was already applied are skipped.
   *
   * @return number of operations newly applied
   */
  int appendOperations(List<Operation> batch);

  /** The live node with this id. */
  Optional<Node> readNode(String id);

  /** Live children of {@code parentId}, ordered by position then id. */
  List<Node> readNodes(String parentId);

  /** Present edges where {@code nodeId} is source or target; {@code kind} may be null. */
  List<Edge> readEdges(String nodeId, String kind);

  List<Node> readAllNodes();

  List<Edge> readAllEdges();

  NodeStatus nodeStatus(String id);

  /** Metadata last written for a node, kept after it is deleted. */
  Map<String, Object> lastSeenMetadata(String id);

  /** Operations of {@code peerId} with a sequence number above {@code cursor}. */
  List<Operation> operationsSince(String peerId, long cursor);

  /** Per peer, the sequence number up to which every operation has been applied. */
  Map<String, Long> versionVector();

  /** Highest sequence number applied for {@code peerId}, gaps included. */
  long highestSeq(String peerId);

  long maxLamport();

  int operationCount();

  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
