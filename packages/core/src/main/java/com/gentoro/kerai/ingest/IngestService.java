package com.gentoro.kerai.ingest;

import com.gentoro.kerai.comment.CommentPipeline;
import com.gentoro.kerai.comment.CommentScanner;
import com.gentoro.kerai.comment.CommentStyle;
import com.gentoro.kerai.comment.RawComment;
import com.gentoro.kerai.crdt.Operation;
import com.gentoro.kerai.crdt.OperationDraft;
import com.gentoro.kerai.crdt.OperationLog;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.extract.NodeIds;
import com.gentoro.kerai.extract.PositionNormalizer;
import com.gentoro.kerai.extract.ReferenceLinker;
import com.gentoro.kerai.extract.StructuralExtractor;
import com.gentoro.kerai.grammar.GrammarParser;
import com.gentoro.kerai.grammar.GrammarRegistry;
import com.gentoro.kerai.grammar.SyntaxTree;
import com.gentoro.kerai.graph.FileFlags;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.normalize.TextNormalizer;
import com.gentoro.kerai.suggest.MarkerStripper;
import com.gentoro.kerai.suggest.SuggestionEngine;
import com.gentoro.kerai.suggest.SuggestionStatus;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Parses a file into the graph.
 *
 * <p>Text is normalized, stripped of advisory markers, parsed, and turned into nodes and edges.
 * The result is diffed against what is stored for the file and the difference is submitted as a
 * single batch. Nothing is committed when any step fails.
 */
public class IngestService {
  private static final Logger log = LoggingService.getLogger(IngestService.class);

  private final OperationLog operationLog;
  private final GrammarRegistry grammars;
  private final SuggestionEngine suggestions;
  private final StructuralExtractor extractor = new StructuralExtractor();
  private final CommentPipeline comments = new CommentPipeline();
  private final CommentScanner scanner = new CommentScanner();
  private final PositionNormalizer positions = new PositionNormalizer();
  private final ReferenceLinker linker;

  public IngestService(
      OperationLog operationLog,
      GrammarRegistry grammars,
      NodeKindRegistry kinds,
      SuggestionEngine suggestions) {
    this.operationLog = operationLog;
    this.grammars = grammars;
    this.suggestions = suggestions;
    this.linker = new ReferenceLinker(kinds);
  }

  public IngestResult ingest(String path, String text) {
    if (path == null || path.isBlank()) {
      throw new ValidationException("File path cannot be null or empty");
    }
    String normalized = TextNormalizer.normalize(text);
    StoredSubtree stored = StoredSubtree.load(operationLog.store(), NodeIds.file(path));

    GrammarParser parser = grammars.forPath(path);
    SyntaxTree tree = parser.parse(path, normalized);
    MarkerStripper.Stripped stripped =
        MarkerStripper.strip(
            normalized,
            standaloneLineComments(normalized, tree),
            suggestions.outstandingRules(stored.nodes()));
    if (!stripped.text().equals(normalized)) tree = parser.parse(path, stripped.text());

    ExtractionResult fresh = extractor.extract(path, stripped.text(), tree);
    comments.apply(fresh, tree.stringSpans());
    positions.apply(fresh);
    linker.apply(fresh);

    FileFlags flags = carryFlags(stored, fresh);

    Set<SuggestionEngine.MarkerKey> markers = new HashSet<>();
    for (MarkerStripper.Hit hit : stripped.hits()) {
      Node target = fresh.unitStartingAt(hit.annotatedLine());
      if (target == null) {
        log.debug(
            "Marker for {} at {}:{} annotates no node", hit.ruleId(), path, hit.annotatedLine());
        continue;
      }
      markers.add(new SuggestionEngine.MarkerKey(hit.ruleId(), target.getId()));
    }
    List<Node> storedSuggestions =
        stored.nodes().stream()
            .filter(n -> NodeKinds.SUGGESTION.equals(n.getKind()))
            .filter(n -> fresh.rootId().equals(n.getParentId()))
            .collect(Collectors.toList());
    suggestions.reconcile(fresh, storedSuggestions, markers, flags);

    List<OperationDraft> drafts = GraphDiff.diff(stored, fresh);
    List<Operation> applied = operationLog.submit(drafts);

    int emitted =
        (int)
            fresh.nodes().stream()
                .filter(n -> NodeKinds.SUGGESTION.equals(n.getKind()))
                .filter(n -> SuggestionEngine.status(n) == SuggestionStatus.EMITTED)
                .count();
    IngestResult result =
        new IngestResult(
            path,
            fresh.rootId(),
            fresh.language(),
            fresh.nodes().size(),
            fresh.edges().size(),
            applied.size(),
            emitted);
    log.info(
        "Ingested {}: {} nodes, {} edges, {} operations",
        path,
        result.nodes(),
        result.edges(),
        result.operations());
    return result;
  }

  private Set<Integer> standaloneLineComments(String normalized, SyntaxTree tree) {
    List<String> lines = TextNormalizer.lines(normalized);
    Set<Integer> out = new HashSet<>();
    for (RawComment c : scanner.scan(lines, tree.stringSpans())) {
      if (c.style() != CommentStyle.LINE) continue;
      String line = lines.get(c.startLine() - 1);
      if (line.substring(0, c.startCol()).isBlank()) out.add(c.startLine());
    }
    return out;
  }

  // Flags live on the stored root and are not part of the text.
  private static FileFlags carryFlags(StoredSubtree stored, ExtractionResult fresh) {
    Node storedRoot = stored.node(fresh.rootId());
    if (storedRoot == null || !storedRoot.getMetadata().containsKey(MetaKeys.FLAGS)) {
      return FileFlags.NONE;
    }
    Node root = fresh.root();
    Map<String, Object> meta = new LinkedHashMap<>(root.getMetadata());
    meta.put(MetaKeys.FLAGS, storedRoot.getMetadata().get(MetaKeys.FLAGS));
    fresh.put(root.withContent(root.getContent(), meta));
    return FileFlags.of(storedRoot);
  }
}
