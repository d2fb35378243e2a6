package com.gentoro.kerai.ingest;

import com.gentoro.kerai.crdt.OperationDraft;
import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKey;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the operations that turn a stored file subtree into a freshly extracted one.
 *
 * <p>Nodes are compared by id. A node only in the fresh result is inserted; one only in the store
 * is deleted. A node in both gets an update when content or metadata differ and a move when parent
 * or position differ. Edges are compared by identity, and re-added when only their metadata
 * changed. Re-ingesting unchanged text yields no operations.
 */
public final class GraphDiff {

  private GraphDiff() {}

  public static List<OperationDraft> diff(StoredSubtree stored, ExtractionResult fresh) {
    List<OperationDraft> drafts = new ArrayList<>();

    for (Node n : rootFirst(fresh)) {
      Node old = stored.node(n.getId());
      if (old == null) {
        drafts.add(OperationDraft.insert(n));
        continue;
      }
      if (!Objects.equals(old.getContent(), n.getContent())
          || !sameMetadata(old.getMetadata(), n.getMetadata())) {
        drafts.add(OperationDraft.update(n.getId(), n.getContent(), n.getMetadata()));
      }
      if (!Objects.equals(old.getParentId(), n.getParentId())
          || old.getPosition() != n.getPosition()) {
        drafts.add(OperationDraft.move(n.getId(), n.getParentId(), n.getPosition()));
      }
    }

    for (Node old : stored.nodes()) {
      if (fresh.node(old.getId()) == null) drafts.add(OperationDraft.delete(old.getId()));
    }

    Map<EdgeKey, Edge> desired = new LinkedHashMap<>();
    for (Edge e : fresh.edges()) desired.put(e.key(), e);
    for (Map.Entry<EdgeKey, Edge> entry : stored.edges().entrySet()) {
      if (!desired.containsKey(entry.getKey())) {
        EdgeKey k = entry.getKey();
        drafts.add(OperationDraft.removeEdge(k.kind(), k.sourceId(), k.targetId()));
      }
    }
    for (Edge e : desired.values()) {
      Edge old = stored.edges().get(e.key());
      if (old == null || !sameMetadata(old.getMetadata(), e.getMetadata())) {
        drafts.add(OperationDraft.addEdge(e));
      }
    }
    return drafts;
  }

  private static List<Node> rootFirst(ExtractionResult fresh) {
    List<Node> ordered = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    ordered.add(fresh.root());
    seen.add(fresh.rootId());
    for (int i = 0; i < ordered.size(); i++) {
      for (Node child : fresh.childrenOf(ordered.get(i).getId())) {
        if (seen.add(child.getId())) ordered.add(child);
      }
    }
    for (Node n : fresh.nodes()) {
      if (seen.add(n.getId())) ordered.add(n);
    }
    return ordered;
  }

  // Stored metadata may have been through a JSON round trip; compare canonical forms.
  private static boolean sameMetadata(Map<String, Object> a, Map<String, Object> b) {
    if (a.equals(b)) return true;
    return JacksonUtility.toCanonicalJson(a).equals(JacksonUtility.toCanonicalJson(b));
  }
}
