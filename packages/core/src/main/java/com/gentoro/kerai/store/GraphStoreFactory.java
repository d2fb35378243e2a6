package com.gentoro.kerai.store;

import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.store.memory.InMemoryGraphStore;
import com.gentoro.kerai.store.spi.GraphStoreProvider;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Resolves the configured {@link GraphStore} through {@link GraphStoreProvider}s. */
public final class GraphStoreFactory {
  private static final Logger log = LoggingService.getLogger(GraphStoreFactory.class);

  private GraphStoreFactory() {}

  public static GraphStore resolve(Configuration configuration) {
    String desired = configuration.getString("kerai.store.driver", "in-memory");
    log.trace("Resolving graph store (desired '{}')", desired);
    ServiceLoader<GraphStoreProvider> loader = ServiceLoader.load(GraphStoreProvider.class);
    for (GraphStoreProvider p : loader) {
      if (p.id().equalsIgnoreCase(desired) && p.isAvailable(configuration)) {
        return p.create(configuration);
      }
    }
    log.warn("Graph store '{}' not available; falling back to in-memory", desired);
    for (GraphStoreProvider p : loader) {
      if (p.id().equalsIgnoreCase("in-memory")) {
        return p.create(configuration);
      }
    }
    return new InMemoryGraphStore();
  }
}
