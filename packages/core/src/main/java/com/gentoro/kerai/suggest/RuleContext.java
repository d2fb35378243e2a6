package com.gentoro.kerai.suggest;

import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.Placement;
import java.util.List;
import java.util.stream.Collectors;

/** Read-only view of a freshly extracted file, as rules see it. */
public final class RuleContext {
  private final ExtractionResult result;
  private final NodeKindRegistry kinds;

  public RuleContext(ExtractionResult result, NodeKindRegistry kinds) {
    this.result = result;
    this.kinds = kinds;
  }

  public String path() {
    return result.path();
  }

  /** File name without directory and extension. */
  public String fileStem() {
    String p = result.path();
    int slash = Math.max(p.lastIndexOf('/'), p.lastIndexOf('\\'));
    String name = p.substring(slash + 1);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /** Structural nodes at every depth, in no particular order. */
  public List<Node> structuralNodes() {
    return result.nodes().stream()
        .filter(n -> kinds.isStructural(n.getKind()))
        .collect(Collectors.toList());
  }

  public boolean isPublic(Node n) {
    String vis = n.metaString(MetaKeys.VISIBILITY);
    return vis != null && vis.startsWith("pub");
  }

  /** Whether a doc comment is placed directly above {@code n}, or inside it before its code. */
  public boolean hasDocComment(Node n) {
    for (Edge e : result.edges()) {
      if (!EdgeKinds.DOCUMENTS.equals(e.getKind()) || !e.getTargetId().equals(n.getId())) continue;
      if (!Placement.ABOVE.wireName().equals(e.getMetadata().get(MetaKeys.PLACEMENT))) continue;
      Node comment = result.node(e.getSourceId());
      if (comment != null && comment.metaBoolean(MetaKeys.DOC)) return true;
    }
    String content = n.getContent();
    if (content == null) return false;
    for (String line : content.split("\n")) {
      String t = line.trim();
      if (t.startsWith("///") || t.startsWith("/**")) return true;
      if (!t.startsWith("#[") && !t.isEmpty()) return false;
    }
    return false;
  }
}
