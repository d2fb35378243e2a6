package com.gentoro.kerai.graph;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central lookup from node kind to its behavior.
 *
 * <p>The kind vocabulary is open: a kind that was never registered behaves as
 * {@link NodeCategory#STRUCTURAL} with the verbatim formatter, so a new grammar can introduce
 * kinds without touching the assembler.
 */
public final class NodeKindRegistry {

  /** Renders the text a node contributes to reconstructed output. */
  @FunctionalInterface
  public interface Formatter {
    String format(Node node);
  }

  public record KindBehavior(NodeCategory category, Formatter formatter) {
    public KindBehavior {
      Objects.requireNonNull(category, "category");
      Objects.requireNonNull(formatter, "formatter");
    }
  }

  private static final Formatter VERBATIM = n -> n.getContent() == null ? "" : n.getContent();
  private static final KindBehavior DEFAULT = new KindBehavior(NodeCategory.STRUCTURAL, VERBATIM);

  private final Map<String, KindBehavior> behaviors = new ConcurrentHashMap<>();

  public NodeKindRegistry register(String kind, NodeCategory category) {
    return register(kind, new KindBehavior(category, VERBATIM));
  }

  public NodeKindRegistry register(String kind, KindBehavior behavior) {
    behaviors.put(Objects.requireNonNull(kind, "kind"), behavior);
    return this;
  }

  public KindBehavior behaviorOf(String kind) {
    return behaviors.getOrDefault(kind, DEFAULT);
  }

  public NodeCategory categoryOf(String kind) {
    return behaviorOf(kind).category();
  }

  public boolean isStructural(String kind) {
    return categoryOf(kind) == NodeCategory.STRUCTURAL;
  }

  /** Registry preloaded with the kinds the built-in pipeline produces. */
  public static NodeKindRegistry defaults() {
    return new NodeKindRegistry()
        .register(NodeKinds.FILE, NodeCategory.FILE)
        .register(NodeKinds.COMMENT_BLOCK, NodeCategory.COMMENT)
        .register(NodeKinds.SUGGESTION, NodeCategory.ANNOTATION);
  }
}
