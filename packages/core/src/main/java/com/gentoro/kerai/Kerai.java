package com.gentoro.kerai;

import com.gentoro.kerai.crdt.OperationLog;
import com.gentoro.kerai.crdt.OperationSigner;
import com.gentoro.kerai.crdt.PeerIdentity;
import com.gentoro.kerai.exception.StateException;
import com.gentoro.kerai.grammar.GrammarRegistry;
import com.gentoro.kerai.graph.NodeKindRegistry;
import com.gentoro.kerai.ingest.IngestService;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.query.GraphQueryService;
import com.gentoro.kerai.reconstruct.Assembler;
import com.gentoro.kerai.reconstruct.OptionResolver;
import com.gentoro.kerai.reconstruct.ReconstructionService;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.store.GraphStoreFactory;
import com.gentoro.kerai.suggest.RuleRegistry;
import com.gentoro.kerai.suggest.SuggestionEngine;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Wires the graph store, the operation log and the services on top of them from configuration.
 *
 * <p>Call {@link #initialize()} once before using any accessor, and {@link #shutdown()} when done.
 */
public class Kerai implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(Kerai.class);

  private final ConfigurationProvider configurationProvider;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private GraphStore store;
  private OperationLog operationLog;
  private NodeKindRegistry kinds;
  private IngestService ingestService;
  private ReconstructionService reconstructionService;
  private GraphQueryService queryService;

  public Kerai(ConfigurationProvider configurationProvider) {
    this.configurationProvider = configurationProvider;
  }

  public Kerai initialize() {
    Configuration cfg = configurationProvider.config();
    LoggingService.applyConfiguration(cfg);

    this.store = GraphStoreFactory.resolve(cfg);
    store.initialize();

    String peerId = configurationProvider.peerId();
    this.operationLog =
        new OperationLog(
            peerId,
            store,
            new OperationSigner(identity(cfg, peerId)),
            cfg.getBoolean("kerai.replication.require-signatures", false));

    this.kinds = NodeKindRegistry.defaults();
    RuleRegistry rules =
        RuleRegistry.defaults().restrictTo(cfg.getList(String.class, "kerai.suggestions.rules"));
    SuggestionEngine suggestions = new SuggestionEngine(rules, kinds);

    this.ingestService =
        new IngestService(operationLog, GrammarRegistry.load(cfg), kinds, suggestions);
    this.reconstructionService =
        new ReconstructionService(
            operationLog, new Assembler(kinds), OptionResolver.fromConfiguration(cfg));
    this.queryService = new GraphQueryService(store);
    log.info("Kerai peer '{}' ready ({} operations in store)", peerId, store.operationCount());
    return this;
  }

  // Keys are optional; without them local operations go out unsigned.
  private static PeerIdentity identity(Configuration cfg, String peerId) {
    String pub = cfg.getString("kerai.peer.public-key", null);
    String priv = cfg.getString("kerai.peer.private-key", null);
    if (pub == null || pub.isBlank() || priv == null || priv.isBlank()) return null;
    PeerIdentity identity = PeerIdentity.fromEncoded(peerId, pub.trim(), priv.trim());
    log.info("Signing operations as {} ({})", peerId, identity.fingerprint());
    return identity;
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public GraphStore store() {
    return ready(store);
  }

  public OperationLog operationLog() {
    return ready(operationLog);
  }

  public NodeKindRegistry kinds() {
    return ready(kinds);
  }

  public IngestService ingest() {
    return ready(ingestService);
  }

  public ReconstructionService reconstruction() {
    return ready(reconstructionService);
  }

  public GraphQueryService query() {
    return ready(queryService);
  }

  /** Release the store. Safe to call more than once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true) && store != null) {
      store.shutdown();
      log.debug("Kerai shut down");
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private static <T> T ready(T component) {
    if (component == null) {
      throw new StateException("Kerai not initialized. Call initialize() first.");
    }
    return component;
  }
}
