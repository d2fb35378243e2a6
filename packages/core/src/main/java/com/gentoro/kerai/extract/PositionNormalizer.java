package com.gentoro.kerai.extract;

import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.graph.Placement;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Puts structural units and comment groups of each region into one ordering space.
 *
 * <p>Siblings are ordered by start line and spaced {@link #STRIDE} apart, leaving room for nodes
 * inserted later between them. A trailing comment sits right after its target. Each node also
 * records how many blank lines preceded it, and each container how many preceded its closing line,
 * which is what reconstruction needs to reproduce the original spacing.
 */
public class PositionNormalizer {
  public static final long STRIDE = 1024L;

  public void apply(ExtractionResult result) {
    for (Region region : result.regions()) {
      List<Node> items =
          result.nodes().stream()
              .filter(n -> region.ownerId().equals(n.getParentId()))
              .filter(n -> !isTrailing(n))
              .sorted(
                  Comparator.comparingInt((Node n) -> n.metaInt(MetaKeys.START_LINE, 0))
                      .thenComparing(Node::getId))
              .collect(Collectors.toList());

      int prevEnd = region.fromLine() - 1;
      long position = 0;
      for (Node n : items) {
        position += STRIDE;
        int start = n.metaInt(MetaKeys.START_LINE, prevEnd + 1);
        Map<String, Object> meta = new LinkedHashMap<>(n.getMetadata());
        meta.put(MetaKeys.BLANK_BEFORE, result.blankLinesBetween(prevEnd, start));
        result.put(
            new Node(n.getId(), n.getKind(), n.getContent(), n.getParentId(), position, meta));
        prevEnd = n.metaInt(MetaKeys.END_LINE, start);
      }

      Node owner = result.node(region.ownerId());
      if (!NodeKinds.FILE.equals(owner.getKind())) {
        Map<String, Object> meta = new LinkedHashMap<>(owner.getMetadata());
        meta.put(
            MetaKeys.BLANK_BEFORE_FOOTER, result.blankLinesBetween(prevEnd, region.toLine() + 1));
        result.put(owner.withContent(owner.getContent(), meta));
      }
    }

    for (Node n : List.copyOf(result.nodes())) {
      if (!isTrailing(n)) continue;
      Node target =
          result.edges().stream()
              .filter(e -> EdgeKinds.DOCUMENTS.equals(e.getKind()))
              .filter(e -> e.getSourceId().equals(n.getId()))
              .map(e -> result.node(e.getTargetId()))
              .findFirst()
              .orElse(null);
      long position = target == null ? 0L : target.getPosition() + 1;
      Map<String, Object> meta = new LinkedHashMap<>(n.getMetadata());
      meta.put(MetaKeys.BLANK_BEFORE, 0);
      result.put(new Node(n.getId(), n.getKind(), n.getContent(), n.getParentId(), position, meta));
    }
  }

  private static boolean isTrailing(Node n) {
    return NodeKinds.COMMENT_BLOCK.equals(n.getKind())
        && Placement.TRAILING.wireName().equals(n.metaString(MetaKeys.PLACEMENT));
  }
}
