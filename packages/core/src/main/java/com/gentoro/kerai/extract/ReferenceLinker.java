package com.gentoro.kerai.extract;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.utility.HashUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Final extraction step: stamps a content hash on every node with content and links structural
 * nodes to the same-file top-level declarations they mention by name.
 */
public class ReferenceLinker {
  private static final Set<String> DEFINITION_KINDS =
      Set.of(
          NodeKinds.FUNCTION,
          NodeKinds.STRUCT,
          NodeKinds.ENUM,
          NodeKinds.TRAIT,
          NodeKinds.TYPE_ALIAS,
          NodeKinds.CONST,
          NodeKinds.STATIC,
          NodeKinds.MACRO_DEF,
          NodeKinds.MOD);

  private final NodeKindRegistry kinds;

  public ReferenceLinker(NodeKindRegistry kinds) {
    this.kinds = kinds;
  }

  public void apply(ExtractionResult result) {
    for (Node n : List.copyOf(result.nodes())) {
      if (n.getContent() == null) continue;
      Map<String, Object> meta = new LinkedHashMap<>(n.getMetadata());
      meta.put(MetaKeys.CONTENT_HASH, HashUtility.sha256Hex(n.getContent()));
      result.put(n.withContent(n.getContent(), meta));
    }

    List<Node> definitions = new ArrayList<>();
    for (Node n : result.childrenOf(result.rootId())) {
      String name = n.metaString(MetaKeys.NAME);
      if (name != null && !name.isEmpty() && DEFINITION_KINDS.contains(n.getKind())) {
        definitions.add(n);
      }
    }
    if (definitions.isEmpty()) return;

    Map<String, Pattern> patterns = new LinkedHashMap<>();
    for (Node d : definitions) {
      String name = d.metaString(MetaKeys.NAME);
      patterns.computeIfAbsent(
          name, k -> Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(k) + "(?![A-Za-z0-9_])"));
    }

    for (Node source : result.nodes()) {
      if (!kinds.isStructural(source.getKind()) || NodeKinds.USE.equals(source.getKind())) continue;
      String text = source.getContent();
      if (text == null) continue;
      for (Node d : definitions) {
        if (d.getId().equals(source.getId())) continue;
        if (patterns.get(d.metaString(MetaKeys.NAME)).matcher(text).find()) {
          result.addEdge(new Edge(EdgeKinds.REFERENCES, source.getId(), d.getId()));
        }
      }
    }
  }
}
