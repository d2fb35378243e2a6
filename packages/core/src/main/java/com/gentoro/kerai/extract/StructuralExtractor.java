package com.gentoro.kerai.extract;

import com.gentoro.kerai.grammar.SyntaxTree;
import com.gentoro.kerai.grammar.SyntaxUnit;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.normalize.TextNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Walks a {@link SyntaxTree} and emits one node per unit, owned by the file root or by the
 * enclosing container.
 *
 * <p>A leaf carries its lines verbatim as content. A container carries its header lines as content
 * and its closing line as {@code footer} metadata; the lines in between belong to its children.
 */
public class StructuralExtractor {
  private static final Logger log = LoggingService.getLogger(StructuralExtractor.class);

  private static final Map<String, String> KIND_BY_HINT = Map.of("fn", NodeKinds.FUNCTION);

  public ExtractionResult extract(String path, String normalizedText, SyntaxTree tree) {
    List<String> lines = TextNormalizer.lines(normalizedText);
    Map<String, Object> rootMeta = new LinkedHashMap<>();
    rootMeta.put(MetaKeys.PATH, path);
    rootMeta.put(MetaKeys.LANGUAGE, tree.language());
    Node root = new Node(NodeIds.file(path), NodeKinds.FILE, null, null, 0L, rootMeta);

    ExtractionResult result = new ExtractionResult(path, tree.language(), lines, root);
    addRegion(result, root.getId(), 1, lines.size(), tree.units());
    log.trace("Extracted {} nodes from {}", result.nodes().size() - 1, path);
    return result;
  }

  private void addRegion(
      ExtractionResult result, String ownerId, int from, int to, List<SyntaxUnit> units) {
    Map<String, Integer> ordinals = new HashMap<>();
    List<String> ids = new ArrayList<>();
    for (SyntaxUnit unit : units) {
      String kind = KIND_BY_HINT.getOrDefault(unit.kindHint(), unit.kindHint());
      String ordinalKey = kind + "\u0000" + (unit.name() == null ? "" : unit.name());
      int ordinal = ordinals.merge(ordinalKey, 1, Integer::sum) - 1;
      String id = NodeIds.unit(ownerId, kind, unit.name(), ordinal);

      Map<String, Object> meta = new LinkedHashMap<>();
      meta.put(MetaKeys.START_LINE, unit.startLine());
      meta.put(MetaKeys.END_LINE, unit.endLine());
      meta.put(MetaKeys.START_COL, unit.startCol());
      meta.put(MetaKeys.END_COL, unit.endCol());
      if (unit.name() != null) meta.put(MetaKeys.NAME, unit.name());
      if (unit.isPublic()) meta.put(MetaKeys.VISIBILITY, unit.visibility());

      String content;
      if (unit.isContainer()) {
        content = slice(result, unit.startLine(), unit.bodyStartLine() - 1);
        meta.put(MetaKeys.FOOTER, result.line(unit.endLine()));
      } else {
        content = slice(result, unit.startLine(), unit.endLine());
      }
      result.put(new Node(id, kind, content, ownerId, 0L, meta));
      ids.add(id);

      if (unit.isContainer()) {
        addRegion(result, id, unit.bodyStartLine(), unit.bodyEndLine(), unit.children());
      }
    }
    result.addRegion(new Region(ownerId, from, to, ids));
  }

  private static String slice(ExtractionResult result, int from, int to) {
    return String.join("\n", result.lines().subList(from - 1, to));
  }
}
