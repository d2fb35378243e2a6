package com.gentoro.kerai.store.spi;

import com.gentoro.kerai.store.GraphStore;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable graph store backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.kerai.store.spi.GraphStoreProvider
 */
public interface GraphStoreProvider {
  /** Unique driver id used in configuration, e.g. "in-memory", "journal". */
  String id();

  /** Whether the provider can operate with the current configuration. */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  GraphStore create(Configuration configuration);
}
