package com.gentoro.kerai.store.providers;

import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.store.memory.InMemoryGraphStore;
import com.gentoro.kerai.store.spi.GraphStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-memory store. */
public class InMemoryGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public GraphStore create(Configuration configuration) {
    return new InMemoryGraphStore();
  }
}
