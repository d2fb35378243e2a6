package com.gentoro.kerai.reconstruct;

import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeCategory;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.graph.Placement;
import com.gentoro.kerai.reconstruct.pass.AttributeOrderingPass;
import com.gentoro.kerai.reconstruct.pass.ImportGroupingPass;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.suggest.SuggestionText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a file subtree in sibling order and emits its text.
 *
 * <p>Every node contributes the blank lines recorded before it, its advisory markers, then its
 * content. A container contributes its header, its children, then its closing line. Trailing
 * comments are glued back onto the last line of their target. Annotation nodes never produce text.
 * With every option off the output is the ingested text, byte for byte.
 */
public class Assembler {
  private final NodeKindRegistry kinds;
  private final ImportGroupingPass importPass = new ImportGroupingPass();
  private final AttributeOrderingPass derivePass = new AttributeOrderingPass();

  public Assembler(NodeKindRegistry kinds) {
    this.kinds = kinds;
  }

  public String assemble(
      GraphStore store,
      Node root,
      ResolvedOptions options,
      Map<String, List<SuggestionText>> pending) {
    Emitter emitter = new Emitter(store, options, pending);
    emitter.region(root.getId(), true);
    List<String> lines = emitter.lines;
    return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
  }

  private final class Emitter {
    private final GraphStore store;
    private final ResolvedOptions options;
    private final Map<String, List<SuggestionText>> pending;
    private final List<String> lines = new ArrayList<>();

    Emitter(GraphStore store, ResolvedOptions options, Map<String, List<SuggestionText>> pending) {
      this.store = store;
      this.options = options;
      this.pending = pending == null ? Map.of() : pending;
    }

    void region(String parentId, boolean fileLevel) {
      Map<String, List<Node>> trailing = new HashMap<>();
      Map<String, String> documented = new HashMap<>();
      List<Node> items = new ArrayList<>();
      for (Node child : store.readNodes(parentId)) {
        NodeCategory category = kinds.categoryOf(child.getKind());
        if (category == NodeCategory.ANNOTATION || category == NodeCategory.FILE) continue;
        if (category == NodeCategory.COMMENT) {
          String target = documentedTarget(child.getId());
          if (target != null) documented.put(child.getId(), target);
          if (placementOf(child) == Placement.TRAILING
              && target != null
              && store.readNode(target).isPresent()) {
            trailing.computeIfAbsent(target, k -> new ArrayList<>()).add(child);
            continue;
          }
        }
        items.add(child);
      }

      if (fileLevel && options.sortImports()) {
        emitWithImportsGrouped(items, documented, trailing);
      } else {
        for (Node item : items) emit(item, trailing, true);
      }
    }

    private void emitWithImportsGrouped(
        List<Node> items, Map<String, String> documented, Map<String, List<Node>> trailing) {
      List<Node> imports = new ArrayList<>();
      for (Node item : items) {
        if (NodeKinds.USE.equals(item.getKind())) imports.add(item);
      }
      if (imports.isEmpty()) {
        for (Node item : items) emit(item, trailing, true);
        return;
      }

      Set<String> block = new HashSet<>();
      Map<String, List<Node>> above = new HashMap<>();
      imports.forEach(n -> block.add(n.getId()));
      for (Node item : items) {
        String target = documented.get(item.getId());
        if (target != null && block.contains(target) && placementOf(item) == Placement.ABOVE) {
          above.computeIfAbsent(target, k -> new ArrayList<>()).add(item);
        }
      }
      above.values().forEach(l -> l.forEach(c -> block.add(c.getId())));

      List<ImportGroupingPass.Entry<List<Node>>> entries = new ArrayList<>();
      for (Node n : imports) {
        entries.add(importPass.entry(n, above.getOrDefault(n.getId(), List.of())));
      }

      boolean emitted = false;
      for (Node item : items) {
        if (!block.contains(item.getId())) {
          emit(item, trailing, true);
          continue;
        }
        if (emitted) continue;
        emitted = true;
        blank(item.metaInt(MetaKeys.BLANK_BEFORE, 0));
        List<List<ImportGroupingPass.Entry<List<Node>>>> groups = importPass.arrange(entries);
        for (int g = 0; g < groups.size(); g++) {
          if (g > 0) lines.add("");
          for (ImportGroupingPass.Entry<List<Node>> e : groups.get(g)) {
            for (Node comment : e.payload()) emit(comment, trailing, false);
            emit(e.node(), trailing, false);
          }
        }
      }
    }

    private void emit(Node node, Map<String, List<Node>> trailing, boolean withSpacing) {
      if (withSpacing) blank(node.metaInt(MetaKeys.BLANK_BEFORE, 0));
      if (kinds.categoryOf(node.getKind()) == NodeCategory.COMMENT) {
        addLines(node.getContent());
        return;
      }

      String text = format(node);
      if (options.suggestions()) {
        String indent = indentOf(text);
        for (SuggestionText s : pending.getOrDefault(node.getId(), List.of())) {
          lines.add(s.marker().render(indent));
        }
      }
      addLines(text);
      for (Node comment : trailing.getOrDefault(node.getId(), List.of())) glue(comment);

      if (node.getMetadata().containsKey(MetaKeys.FOOTER)) {
        region(node.getId(), false);
        blank(node.metaInt(MetaKeys.BLANK_BEFORE_FOOTER, 0));
        lines.add(node.metaString(MetaKeys.FOOTER));
      }
    }

    private String format(Node node) {
      String text = kinds.behaviorOf(node.getKind()).formatter().format(node);
      if (options.orderDerives()) text = derivePass.apply(text);
      if (options.sortImports() && NodeKinds.USE.equals(node.getKind())) {
        text = importPass.apply(text);
      }
      return text;
    }

    private void glue(Node comment) {
      if (comment.getContent() == null) return;
      String gap =
          comment.getMetadata().containsKey(MetaKeys.GAP) ? comment.metaString(MetaKeys.GAP) : " ";
      String[] parts = comment.getContent().split("\n", -1);
      if (lines.isEmpty()) {
        lines.add(parts[0]);
      } else {
        int last = lines.size() - 1;
        lines.set(last, lines.get(last) + gap + parts[0]);
      }
      lines.addAll(Arrays.asList(parts).subList(1, parts.length));
    }

    private String documentedTarget(String commentId) {
      for (Edge e : store.readEdges(commentId, EdgeKinds.DOCUMENTS)) {
        if (e.getSourceId().equals(commentId)) return e.getTargetId();
      }
      return null;
    }

    private void addLines(String text) {
      if (text == null) return;
      lines.addAll(Arrays.asList(text.split("\n", -1)));
    }

    private void blank(int count) {
      for (int i = 0; i < count; i++) lines.add("");
    }
  }

  private static Placement placementOf(Node comment) {
    return Placement.fromWire(comment.metaString(MetaKeys.PLACEMENT));
  }

  static String indentOf(String text) {
    if (text == null) return "";
    int i = 0;
    while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) i++;
    return text.substring(0, i);
  }
}
