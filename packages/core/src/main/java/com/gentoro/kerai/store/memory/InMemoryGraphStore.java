package com.gentoro.kerai.store.memory;

import com.gentoro.kerai.crdt.GraphState;
import com.gentoro.kerai.crdt.Operation;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import com.gentoro.kerai.store.GraphStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Graph store that keeps everything in process memory. Used for tests and one-shot runs. */
public class InMemoryGraphStore implements GraphStore {
  protected final GraphState state = new GraphState();

  @Override
  public void initialize() {}

  @Override
  public synchronized int appendOperations(List<Operation> batch) {
    int applied = 0;
    for (Operation op : batch) {
      if (state.apply(op)) applied++;
    }
    return applied;
  }

  @Override
  public synchronized Optional<Node> readNode(String id) {
    return state.node(id);
  }

  @Override
  public synchronized List<Node> readNodes(String parentId) {
    return state.children(parentId);
  }

  @Override
  public synchronized List<Edge> readEdges(String nodeId, String kind) {
    return state.edges(nodeId, kind);
  }

  @Override
  public synchronized List<Node> readAllNodes() {
    return state.liveNodes();
  }

  @Override
  public synchronized List<Edge> readAllEdges() {
    return state.allEdges();
  }

  @Override
  public synchronized NodeStatus nodeStatus(String id) {
    return state.status(id);
  }

  @Override
  public synchronized Map<String, Object> lastSeenMetadata(String id) {
    return state.lastSeenMetadata(id);
  }

  @Override
  public synchronized List<Operation> operationsSince(String peerId, long cursor) {
    return state.operationsSince(peerId, cursor);
  }

  @Override
  public synchronized Map<String, Long> versionVector() {
    return state.versionVector().asMap();
  }

  @Override
  public synchronized long highestSeq(String peerId) {
    return state.versionVector().highest(peerId);
  }

  @Override
  public synchronized long maxLamport() {
    return state.maxLamport();
  }

  @Override
  public synchronized int operationCount() {
    return state.operations().size();
  }

  @Override
  public void shutdown() {}
}
