package com.gentoro.kerai.query;

import com.gentoro.kerai.exception.NotFoundException;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.ingest.StoredSubtree;
import com.gentoro.kerai.store.GraphStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Read-only navigation over the stored graph. */
public class GraphQueryService {
  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 1000;

  private static final Comparator<Node> BY_NAME =
      Comparator.comparing((Node n) -> String.valueOf(nameOf(n)))
          .thenComparing(Node::getKind)
          .thenComparing(Node::getId);

  /** Definitions of a symbol and the nodes that reference them. */
  public record Refs(String symbol, List<Node> definitions, List<Node> references) {}

  /** Counts describing the store. */
  public record Status(
      int files, int nodes, int edges, int operations, Map<String, Long> versionVector) {}

  private final GraphStore store;

  public GraphQueryService(GraphStore store) {
    this.store = store;
  }

  /**
   * Nodes whose name matches {@code pattern}, case-insensitively. {@code %} matches any run of
   * characters and {@code _} any single character. File roots match on their path.
   *
   * @param kind only nodes of this kind, or {@code null} for any
   * @param limit clamped to 1..{@value #MAX_LIMIT}; {@code null} means {@value #DEFAULT_LIMIT}
   */
  public List<Node> find(String pattern, String kind, Integer limit) {
    if (pattern == null || pattern.isEmpty()) {
      throw new ValidationException("Search pattern cannot be null or empty");
    }
    int max = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
    Pattern regex = likePattern(pattern);
    return store.readAllNodes().stream()
        .filter(n -> kind == null || kind.equals(n.getKind()))
        .filter(n -> nameOf(n) != null && regex.matcher(nameOf(n)).matches())
        .sorted(BY_NAME)
        .limit(max)
        .collect(Collectors.toList());
  }

  public List<Node> children(String id) {
    require(id);
    return store.readNodes(id);
  }

  /** Parent chain of a node, nearest first, ending at its file root. */
  public List<Node> ancestors(String id) {
    Node current = require(id);
    List<Node> chain = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    seen.add(current.getId());
    while (current.getParentId() != null) {
      Optional<Node> parent = store.readNode(current.getParentId());
      if (parent.isEmpty() || !seen.add(parent.get().getId())) break;
      current = parent.get();
      chain.add(current);
    }
    return chain;
  }

  public Refs refs(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new ValidationException("Symbol cannot be null or empty");
    }
    List<Node> definitions =
        store.readAllNodes().stream()
            .filter(n -> symbol.equals(n.metaString(MetaKeys.NAME)))
            .filter(n -> !NodeKinds.USE.equals(n.getKind()))
            .sorted(BY_NAME)
            .collect(Collectors.toList());
    Map<String, Node> references = new LinkedHashMap<>();
    for (Node def : definitions) {
      for (Edge e : store.readEdges(def.getId(), EdgeKinds.REFERENCES)) {
        if (!e.getTargetId().equals(def.getId())) continue;
        store.readNode(e.getSourceId()).ifPresent(n -> references.putIfAbsent(n.getId(), n));
      }
    }
    List<Node> refs = new ArrayList<>(references.values());
    refs.sort(BY_NAME);
    return new Refs(symbol, definitions, refs);
  }

  /**
   * Present edges whose target is no longer live. Limited to edges leaving the subtree of {@code
   * fileId}, or every edge in the store when it is {@code null}.
   */
  public List<Edge> danglingEdges(String fileId) {
    List<Edge> candidates =
        fileId == null
            ? store.readAllEdges()
            : new ArrayList<>(StoredSubtree.load(store, fileId).edges().values());
    return candidates.stream()
        .filter(e -> store.readNode(e.getTargetId()).isEmpty())
        .collect(Collectors.toList());
  }

  public Status status() {
    List<Node> nodes = store.readAllNodes();
    int files = (int) nodes.stream().filter(n -> NodeKinds.FILE.equals(n.getKind())).count();
    return new Status(
        files,
        nodes.size(),
        store.readAllEdges().size(),
        store.operationCount(),
        store.versionVector());
  }

  private Node require(String id) {
    return store.readNode(id).orElseThrow(() -> new NotFoundException("No live node " + id));
  }

  private static String nameOf(Node n) {
    return NodeKinds.FILE.equals(n.getKind())
        ? n.metaString(MetaKeys.PATH)
        : n.metaString(MetaKeys.NAME);
  }

  static Pattern likePattern(String pattern) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : pattern.toCharArray()) {
      if (c == '%' || c == '_') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '%' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  }
}
