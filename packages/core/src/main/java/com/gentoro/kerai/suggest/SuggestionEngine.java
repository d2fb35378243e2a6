package com.gentoro.kerai.suggest;

import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.extract.NodeIds;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.FileFlags;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.store.GraphStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * Owns suggestion nodes: detects status changes from re-parsed text, runs the rules, and applies
 * the one-shot lifecycle.
 *
 * <table>
 *   <caption>Lifecycle</caption>
 *   <tr><th>stored</th><th>observed</th><th>result</th></tr>
 *   <tr><td>none</td><td>rule fires</td><td>emitted, hash recorded</td></tr>
 *   <tr><td>dismissed</td><td>rule fires, same hash</td><td>suppressed</td></tr>
 *   <tr><td>dismissed</td><td>rule fires, new hash</td><td>emitted again, new hash</td></tr>
 *   <tr><td>emitted</td><td>marker gone, same hash</td><td>dismissed</td></tr>
 *   <tr><td>emitted</td><td>marker gone, hash changed or target gone</td><td>applied</td></tr>
 * </table>
 */
public class SuggestionEngine {
  private static final Logger log = LoggingService.getLogger(SuggestionEngine.class);

  /** Suggestions sort after all code siblings; they are never rendered as nodes. */
  static final long POSITION_BASE = 1L << 40;

  static final long STRIDE = 1024L;

  /** A marker observed in re-parsed text, re-associated with its target node. */
  public record MarkerKey(String ruleId, String targetId) {}

  private final RuleRegistry rules;
  private final NodeKindRegistry kinds;

  public SuggestionEngine(RuleRegistry rules, NodeKindRegistry kinds) {
    this.rules = rules;
    this.kinds = kinds;
  }

  /**
   * Compute the suggestion nodes of a fresh extraction and add them, with their {@code suggests}
   * edges, to {@code fresh}.
   *
   * @param stored suggestion nodes currently stored for the file
   * @param markers advisory markers found in the text that was parsed
   */
  public void reconcile(
      ExtractionResult fresh, List<Node> stored, Set<MarkerKey> markers, FileFlags flags) {
    Map<String, Node> byId = new LinkedHashMap<>();
    stored.stream()
        .sorted(Comparator.comparingLong(Node::getPosition).thenComparing(Node::getId))
        .forEach(n -> byId.put(n.getId(), n));

    if (!flags.suggestionsDisabled()) {
      for (Node s : List.copyOf(byId.values())) {
        if (status(s) != SuggestionStatus.EMITTED) continue;
        String targetId = s.metaString(MetaKeys.TARGET_ID);
        if (markers.contains(new MarkerKey(s.metaString(MetaKeys.RULE), targetId))) continue;
        Node target = fresh.node(targetId);
        boolean unchanged =
            target != null
                && Objects.equals(
                    target.metaString(MetaKeys.CONTENT_HASH), s.metaString(MetaKeys.TARGET_HASH));
        SuggestionStatus next = unchanged ? SuggestionStatus.DISMISSED : SuggestionStatus.APPLIED;
        log.debug(
            "Suggestion {} on {} in {}: emitted -> {}",
            s.metaString(MetaKeys.RULE),
            targetId,
            fresh.path(),
            next.wireName());
        byId.put(s.getId(), withStatus(s, next, s.metaString(MetaKeys.TARGET_HASH), null));
      }
    }

    long nextPosition =
        byId.values().stream().mapToLong(Node::getPosition).max().orElse(POSITION_BASE);
    List<Finding> findings = rules.inspect(new RuleContext(fresh, kinds));
    for (Finding f : findings) {
      Node target = fresh.node(f.targetId());
      if (target == null) continue;
      String hash = target.metaString(MetaKeys.CONTENT_HASH);
      String id = NodeIds.suggestion(fresh.rootId(), f.ruleId(), f.targetId());
      Node existing = byId.get(id);
      if (existing == null) {
        nextPosition += STRIDE;
        byId.put(id, create(id, fresh.rootId(), nextPosition, f, hash));
        log.debug("Suggestion {} on {} in {}: emitted", f.ruleId(), f.targetId(), fresh.path());
      } else if (status(existing) == SuggestionStatus.DISMISSED
          && !Objects.equals(hash, existing.metaString(MetaKeys.TARGET_HASH))) {
        byId.put(id, withStatus(existing, SuggestionStatus.EMITTED, hash, f.message()));
        log.debug(
            "Suggestion {} on {} in {}: dismissed -> emitted (target changed)",
            f.ruleId(),
            f.targetId(),
            fresh.path());
      }
    }

    for (Node s : byId.values()) {
      fresh.put(s);
      String targetId = s.metaString(MetaKeys.TARGET_ID);
      if (fresh.node(targetId) != null) {
        fresh.addEdge(new Edge(EdgeKinds.SUGGESTS, s.getId(), targetId));
      }
    }
  }

  /** Registered rules with an emitted suggestion among {@code stored}; only their markers strip. */
  public Set<String> outstandingRules(Collection<Node> stored) {
    Set<String> out = new HashSet<>();
    for (Node s : stored) {
      if (!NodeKinds.SUGGESTION.equals(s.getKind()) || status(s) != SuggestionStatus.EMITTED) {
        continue;
      }
      String rule = s.metaString(MetaKeys.RULE);
      if (rule != null && rules.contains(rule)) out.add(rule);
    }
    return out;
  }

  /** Emitted suggestions of a file whose target is live, grouped by target node id. */
  public static Map<String, List<SuggestionText>> pendingSuggestions(
      GraphStore store, String fileId) {
    Map<String, List<SuggestionText>> out = new TreeMap<>();
    for (Node s : store.readNodes(fileId)) {
      if (!NodeKinds.SUGGESTION.equals(s.getKind()) || status(s) != SuggestionStatus.EMITTED) {
        continue;
      }
      String targetId = s.metaString(MetaKeys.TARGET_ID);
      if (targetId == null || store.readNode(targetId).isEmpty()) continue;
      out.computeIfAbsent(targetId, k -> new ArrayList<>())
          .add(new SuggestionText(s.metaString(MetaKeys.RULE), s.metaString(MetaKeys.MESSAGE)));
    }
    out.values().forEach(l -> l.sort(Comparator.comparing(SuggestionText::ruleId)));
    return out;
  }

  public static SuggestionStatus status(Node suggestion) {
    return SuggestionStatus.fromWire(suggestion.metaString(MetaKeys.STATUS));
  }

  private static Node create(String id, String fileId, long position, Finding f, String hash) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put(MetaKeys.STATUS, SuggestionStatus.EMITTED.wireName());
    meta.put(MetaKeys.RULE, f.ruleId());
    meta.put(MetaKeys.TARGET_ID, f.targetId());
    meta.put(MetaKeys.TARGET_HASH, hash);
    meta.put(MetaKeys.MESSAGE, f.message());
    return new Node(id, NodeKinds.SUGGESTION, f.message(), fileId, position, meta);
  }

  private static Node withStatus(
      Node s, SuggestionStatus status, String targetHash, String message) {
    Map<String, Object> meta = new LinkedHashMap<>(s.getMetadata());
    meta.put(MetaKeys.STATUS, status.wireName());
    meta.put(MetaKeys.TARGET_HASH, targetHash);
    String content = s.getContent();
    if (message != null) {
      meta.put(MetaKeys.MESSAGE, message);
      content = message;
    }
    return s.withContent(content, meta);
  }
}
