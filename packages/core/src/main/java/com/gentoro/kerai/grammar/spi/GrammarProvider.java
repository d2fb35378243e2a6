package com.gentoro.kerai.grammar.spi;

import com.gentoro.kerai.grammar.GrammarParser;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable grammars.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.kerai.grammar.spi.GrammarProvider
 */
public interface GrammarProvider {
  /** Unique grammar id, e.g. "rust". */
  String id();

  /** Whether the grammar can operate with the current configuration. */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  GrammarParser create(Configuration configuration);
}
