package com.gentoro.kerai.comment;

import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.extract.NodeIds;
import com.gentoro.kerai.extract.Region;
import com.gentoro.kerai.grammar.LineSpan;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.graph.Placement;
import com.gentoro.kerai.logging.LoggingService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Turns free-floating comments into {@code comment_block} nodes with {@code documents} edges.
 *
 * <p>Works region by region. A comment on lines no unit of the region covers is standalone: it is
 * grouped, classified and parented to the region owner. A comment that starts after code on the
 * last line of a leaf unit and runs to the end of that line is trailing: it becomes its own node
 * and is cut from the unit's content. Any other comment is part of the unit it sits in.
 */
public class CommentPipeline {
  private static final Logger log = LoggingService.getLogger(CommentPipeline.class);

  private final CommentScanner scanner = new CommentScanner();
  private final CommentGrouper grouper = new CommentGrouper();
  private final PlacementClassifier classifier = new PlacementClassifier();

  public void apply(ExtractionResult result, List<LineSpan> stringSpans) {
    List<RawComment> raw = scanner.scan(result.lines(), stringSpans);
    for (Region region : result.regions()) {
      if (!region.isEmpty()) processRegion(result, region, raw);
    }
  }

  private void processRegion(ExtractionResult result, Region region, List<RawComment> raw) {
    List<Node> units = new ArrayList<>();
    for (String id : region.unitIds()) units.add(result.node(id));
    units.sort(Comparator.comparingInt(n -> n.metaInt(MetaKeys.START_LINE, 0)));

    List<RawComment> standalone = new ArrayList<>();
    for (RawComment c : raw) {
      if (c.startLine() < region.fromLine() || c.startLine() > region.toLine()) continue;
      Node covering = covering(units, c.startLine());
      if (covering == null) {
        addStandalone(result, standalone, c);
      } else if (isTrailing(result, covering, c)) {
        attachTrailing(result, region, covering, c);
      }
    }

    List<PlacementClassifier.Span> spans = new ArrayList<>();
    for (Node u : units) {
      spans.add(
          new PlacementClassifier.Span(
              u.getId(), u.metaInt(MetaKeys.START_LINE, 0), u.metaInt(MetaKeys.END_LINE, 0)));
    }

    int ordinal = 0;
    for (CommentGroup group : grouper.group(standalone)) {
      PlacementClassifier.Classification cls =
          classifier.classify(group, spans, result::blankLinesBetween);
      if (cls.ambiguous()) {
        log.debug(
            "Comment at {}:{} has no previous node and a blank line before the next; using eof",
            result.path(),
            group.startLine());
      }
      String id = NodeIds.comment(region.ownerId(), ordinal++);
      Map<String, Object> meta = new LinkedHashMap<>();
      meta.put(MetaKeys.START_LINE, group.startLine());
      meta.put(MetaKeys.END_LINE, group.endLine());
      meta.put(MetaKeys.COL, group.col());
      meta.put(MetaKeys.PLACEMENT, cls.placement().wireName());
      meta.put(MetaKeys.STYLE, group.first().style().wireName());
      meta.put(MetaKeys.DOC, group.first().doc());
      meta.put(MetaKeys.INNER, group.first().inner());
      meta.put(MetaKeys.LINE_COUNT, group.lineCount());
      String content =
          String.join("\n", result.lines().subList(group.startLine() - 1, group.endLine()));
      result.put(new Node(id, NodeKinds.COMMENT_BLOCK, content, region.ownerId(), 0L, meta));
      if (cls.targetId() != null) {
        result.addEdge(
            new Edge(
                EdgeKinds.DOCUMENTS,
                id,
                cls.targetId(),
                Map.of(MetaKeys.PLACEMENT, cls.placement().wireName())));
      }
    }
  }

  private void addStandalone(ExtractionResult result, List<RawComment> standalone, RawComment c) {
    if (!standalone.isEmpty()) {
      RawComment last = standalone.get(standalone.size() - 1);
      if (last.endLine() == c.startLine()) {
        standalone.set(standalone.size() - 1, last.mergeWith(c));
        return;
      }
    }
    if (!result.line(c.startLine()).substring(0, c.startCol()).isBlank()) {
      log.debug("Ignoring comment after non-code text at {}:{}", result.path(), c.startLine());
      return;
    }
    standalone.add(c);
  }

  private static Node covering(List<Node> units, int line) {
    for (Node u : units) {
      if (line >= u.metaInt(MetaKeys.START_LINE, 0) && line <= u.metaInt(MetaKeys.END_LINE, 0)) {
        return u;
      }
    }
    return null;
  }

  private static boolean isTrailing(ExtractionResult result, Node unit, RawComment c) {
    if (unit.getMetadata().containsKey(MetaKeys.FOOTER)) return false;
    int last = unit.metaInt(MetaKeys.END_LINE, 0);
    if (c.startLine() != last || c.endLine() != last) return false;
    String line = result.line(last);
    return c.endCol() == line.length() && !line.substring(0, c.startCol()).isBlank();
  }

  private void attachTrailing(ExtractionResult result, Region region, Node unit, RawComment c) {
    String id = NodeIds.trailingComment(unit.getId());
    if (result.node(id) != null) return;

    String line = result.line(c.startLine());
    String code = line.substring(0, c.startCol()).stripTrailing();
    String gap = line.substring(code.length(), c.startCol());

    String content = unit.getContent();
    int cut = content.lastIndexOf('\n');
    result.put(unit.withContent(content.substring(0, cut + 1) + code, unit.getMetadata()));

    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put(MetaKeys.START_LINE, c.startLine());
    meta.put(MetaKeys.END_LINE, c.endLine());
    meta.put(MetaKeys.COL, c.startCol());
    meta.put(MetaKeys.PLACEMENT, Placement.TRAILING.wireName());
    meta.put(MetaKeys.STYLE, c.style().wireName());
    meta.put(MetaKeys.DOC, c.doc());
    meta.put(MetaKeys.INNER, c.inner());
    meta.put(MetaKeys.LINE_COUNT, 1);
    meta.put(MetaKeys.GAP, gap);
    result.put(
        new Node(
            id, NodeKinds.COMMENT_BLOCK, line.substring(c.startCol()), region.ownerId(), 0L, meta));
    result.addEdge(
        new Edge(
            EdgeKinds.DOCUMENTS,
            id,
            unit.getId(),
            Map.of(MetaKeys.PLACEMENT, Placement.TRAILING.wireName())));
  }
}
