package com.gentoro.kerai.reconstruct;

import com.gentoro.kerai.crdt.OperationDraft;
import com.gentoro.kerai.crdt.OperationLog;
import com.gentoro.kerai.exception.NotFoundException;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.extract.NodeIds;
import com.gentoro.kerai.graph.FileFlags;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.suggest.SuggestionEngine;
import com.gentoro.kerai.suggest.SuggestionText;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;

/** Turns stored file subtrees back into text, and manages the per-file reconstruction flags. */
public class ReconstructionService {
  private static final Logger log = LoggingService.getLogger(ReconstructionService.class);

  private final OperationLog operationLog;
  private final Assembler assembler;
  private final OptionResolver resolver;

  public ReconstructionService(
      OperationLog operationLog, Assembler assembler, OptionResolver resolver) {
    this.operationLog = operationLog;
    this.assembler = assembler;
    this.resolver = resolver;
  }

  /**
   * Reconstruct the file rooted at {@code rootId}.
   *
   * @throws NotFoundException if no live file root has that id
   */
  public String reconstruct(String rootId, ReconstructionOptions options) {
    GraphStore store = operationLog.store();
    Node root = fileRoot(rootId);
    ResolvedOptions resolved = resolver.resolve(options, FileFlags.of(root));
    Map<String, List<SuggestionText>> pending =
        resolved.suggestions() ? SuggestionEngine.pendingSuggestions(store, rootId) : Map.of();
    String text = assembler.assemble(store, root, resolved, pending);
    log.debug(
        "Reconstructed {} ({} chars, options {})",
        root.metaString(MetaKeys.PATH),
        text.length(),
        resolved);
    return text;
  }

  public String reconstructPath(String path, ReconstructionOptions options) {
    return reconstruct(NodeIds.file(path), options);
  }

  /** Every live file, keyed and ordered by path. */
  public Map<String, String> reconstructAll(ReconstructionOptions options) {
    Map<String, String> out = new TreeMap<>();
    for (Node n : operationLog.store().readAllNodes()) {
      if (NodeKinds.FILE.equals(n.getKind())) {
        out.put(n.metaString(MetaKeys.PATH), reconstruct(n.getId(), options));
      }
    }
    return out;
  }

  public FileFlags fileFlags(String rootId) {
    return FileFlags.of(fileRoot(rootId));
  }

  /** Persist {@code flags} on the file root as a normal content update. */
  public void setFileFlags(String rootId, FileFlags flags) {
    if (flags == null) throw new ValidationException("File flags cannot be null");
    Node root = fileRoot(rootId);
    Map<String, Object> meta = new LinkedHashMap<>(root.getMetadata());
    if (flags.isEmpty()) {
      meta.remove(MetaKeys.FLAGS);
    } else {
      meta.put(MetaKeys.FLAGS, flags.toMap());
    }
    if (meta.equals(root.getMetadata())) return;
    operationLog.submit(List.of(OperationDraft.update(rootId, root.getContent(), meta)));
    log.info("Flags of {} set to {}", root.metaString(MetaKeys.PATH), flags);
  }

  private Node fileRoot(String rootId) {
    Node root =
        operationLog
            .store()
            .readNode(rootId)
            .orElseThrow(() -> new NotFoundException("No file with root id " + rootId));
    if (!NodeKinds.FILE.equals(root.getKind())) {
      throw new ValidationException("Node " + rootId + " is not a file root");
    }
    return root;
  }
}
