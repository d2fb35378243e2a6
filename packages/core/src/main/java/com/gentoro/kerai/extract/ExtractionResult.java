package com.gentoro.kerai.extract;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKey;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Working set for one file while it moves through extraction, comment placement and position
 * normalization. Nodes are immutable; later stages replace them by id.
 */
public final class ExtractionResult {
  private final String path;
  private final String language;
  private final List<String> lines;
  private final String rootId;
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<EdgeKey, Edge> edges = new LinkedHashMap<>();
  private final List<Region> regions = new ArrayList<>();

  public ExtractionResult(String path, String language, List<String> lines, Node root) {
    this.path = Objects.requireNonNull(path, "path");
    this.language = language;
    this.lines = List.copyOf(lines);
    this.rootId = root.getId();
    nodes.put(root.getId(), root);
  }

  public String path() {
    return path;
  }

  public String language() {
    return language;
  }

  /** Lines of the normalized text; line number {@code n} is at index {@code n-1}. */
  public List<String> lines() {
    return lines;
  }

  public String line(int lineNumber) {
    return lines.get(lineNumber - 1);
  }

  public String rootId() {
    return rootId;
  }

  public Node root() {
    return nodes.get(rootId);
  }

  public Node node(String id) {
    return nodes.get(id);
  }

  /** Adds or replaces a node. */
  public void put(Node node) {
    nodes.put(node.getId(), node);
  }

  public Collection<Node> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public void addEdge(Edge edge) {
    edges.put(edge.key(), edge);
  }

  public Collection<Edge> edges() {
    return Collections.unmodifiableCollection(edges.values());
  }

  public void addRegion(Region region) {
    regions.add(region);
  }

  public List<Region> regions() {
    return Collections.unmodifiableList(regions);
  }

  public List<Node> childrenOf(String parentId) {
    return nodes.values().stream()
        .filter(n -> parentId.equals(n.getParentId()))
        .sorted(Comparator.comparingLong(Node::getPosition).thenComparing(Node::getId))
        .collect(Collectors.toList());
  }

  /** Number of empty lines strictly between lines {@code after} and {@code before}. */
  public int blankLinesBetween(int after, int before) {
    int count = 0;
    for (int l = Math.max(1, after + 1); l < before && l <= lines.size(); l++) {
      if (lines.get(l - 1).isEmpty()) count++;
    }
    return count;
  }

  /** Structural node whose span starts at {@code lineNumber}, searching every region. */
  public Node unitStartingAt(int lineNumber) {
    for (Region region : regions) {
      for (String id : region.unitIds()) {
        Node n = nodes.get(id);
        if (n.metaInt(MetaKeys.START_LINE, -1) == lineNumber) return n;
      }
    }
    return null;
  }
}
