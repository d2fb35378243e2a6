package com.gentoro.kerai.ingest;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKey;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.store.GraphStore;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Live nodes under a file root, plus the edges whose source is one of them. */
public final class StoredSubtree {
  private final Map<String, Node> nodes;
  private final Map<EdgeKey, Edge> edges;

  private StoredSubtree(Map<String, Node> nodes, Map<EdgeKey, Edge> edges) {
    this.nodes = nodes;
    this.edges = edges;
  }

  public static StoredSubtree load(GraphStore store, String rootId) {
    Map<String, Node> nodes = new LinkedHashMap<>();
    Optional<Node> root = store.readNode(rootId);
    if (root.isEmpty()) return new StoredSubtree(nodes, new LinkedHashMap<>());

    Deque<Node> pending = new ArrayDeque<>();
    pending.add(root.get());
    while (!pending.isEmpty()) {
      Node n = pending.poll();
      if (nodes.putIfAbsent(n.getId(), n) != null) continue;
      pending.addAll(store.readNodes(n.getId()));
    }

    Map<EdgeKey, Edge> edges = new LinkedHashMap<>();
    for (String id : nodes.keySet()) {
      for (Edge e : store.readEdges(id, null)) {
        if (e.getSourceId().equals(id)) edges.put(e.key(), e);
      }
    }
    return new StoredSubtree(nodes, edges);
  }

  public Node node(String id) {
    return nodes.get(id);
  }

  public Collection<Node> nodes() {
    return nodes.values();
  }

  public boolean contains(String id) {
    return nodes.containsKey(id);
  }

  public Map<EdgeKey, Edge> edges() {
    return edges;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }
}
