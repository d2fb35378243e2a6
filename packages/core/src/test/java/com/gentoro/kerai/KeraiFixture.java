package com.gentoro.kerai;

import com.gentoro.kerai.crdt.OperationLog;
import com.gentoro.kerai.extract.NodeIds;
import com.gentoro.kerai.grammar.GrammarRegistry;
import com.gentoro.kerai.grammar.brace.BraceGrammarParser;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.ingest.IngestService;
import com.gentoro.kerai.query.GraphQueryService;
import com.gentoro.kerai.reconstruct.Assembler;
import com.gentoro.kerai.reconstruct.OptionResolver;
import com.gentoro.kerai.reconstruct.ReconstructionService;
import com.gentoro.kerai.reconstruct.ResolvedOptions;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.store.memory.InMemoryGraphStore;
import com.gentoro.kerai.suggest.RuleRegistry;
import com.gentoro.kerai.suggest.SuggestionEngine;
import java.util.List;
import java.util.stream.Collectors;

/** Services wired over one store, the way {@link Kerai} wires them, without configuration. */
public final class KeraiFixture {
  public final NodeKindRegistry kinds = NodeKindRegistry.defaults();
  public final GraphStore store;
  public final OperationLog log;
  public final IngestService ingest;
  public final ReconstructionService reconstruction;
  public final GraphQueryService query;

  public KeraiFixture(String peerId, GraphStore store, RuleRegistry rules) {
    this.store = store;
    this.log = new OperationLog(peerId, store);
    GrammarRegistry grammars = new GrammarRegistry("rust").register(new BraceGrammarParser());
    this.ingest = new IngestService(log, grammars, kinds, new SuggestionEngine(rules, kinds));
    this.reconstruction =
        new ReconstructionService(
            log, new Assembler(kinds), new OptionResolver(new ResolvedOptions(true, true, true)));
    this.query = new GraphQueryService(store);
  }

  /** In-memory store, no suggestion rules. */
  public static KeraiFixture plain() {
    return new KeraiFixture("local", new InMemoryGraphStore(), new RuleRegistry());
  }

  public static KeraiFixture withRules(RuleRegistry rules) {
    return new KeraiFixture("local", new InMemoryGraphStore(), rules);
  }

  public static String rootId(String path) {
    return NodeIds.file(path);
  }

  /** Live node of {@code kind} named {@code name} anywhere in the store. */
  public Node named(String kind, String name) {
    return store.readAllNodes().stream()
        .filter(n -> kind.equals(n.getKind()) && name.equals(n.metaString("name")))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No " + kind + " named " + name));
  }

  public List<Node> suggestions(String path) {
    return store.readNodes(rootId(path)).stream()
        .filter(n -> NodeKinds.SUGGESTION.equals(n.getKind()))
        .collect(Collectors.toList());
  }
}
