package com.gentoro.kerai.grammar;

import com.gentoro.kerai.exception.ConfigException;
import com.gentoro.kerai.grammar.spi.GrammarProvider;
import com.gentoro.kerai.logging.LoggingService;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Resolves a {@link GrammarParser} by id or by file extension. */
public final class GrammarRegistry {
  private static final Logger log = LoggingService.getLogger(GrammarRegistry.class);

  private final Map<String, GrammarParser> byId = new LinkedHashMap<>();
  private final Map<String, GrammarParser> byExtension = new LinkedHashMap<>();
  private final String defaultId;

  public GrammarRegistry(String defaultId) {
    this.defaultId = defaultId;
  }

  /** Registry populated from every available {@link GrammarProvider} on the class path. */
  public static GrammarRegistry load(Configuration configuration) {
    GrammarRegistry registry =
        new GrammarRegistry(configuration.getString("kerai.grammar.default", "rust"));
    for (GrammarProvider provider : ServiceLoader.load(GrammarProvider.class)) {
      if (!provider.isAvailable(configuration)) {
        log.debug("Grammar provider '{}' not available; skipping", provider.id());
        continue;
      }
      registry.register(provider.create(configuration));
    }
    log.trace("Loaded grammars {}", registry.byId.keySet());
    return registry;
  }

  public GrammarRegistry register(GrammarParser parser) {
    byId.put(parser.id().toLowerCase(Locale.ROOT), parser);
    for (String ext : parser.extensions()) {
      byExtension.put(ext.toLowerCase(Locale.ROOT), parser);
    }
    return this;
  }

  public Optional<GrammarParser> byId(String id) {
    return Optional.ofNullable(id == null ? null : byId.get(id.toLowerCase(Locale.ROOT)));
  }

  /** Grammar for {@code path}'s extension, or the configured default grammar. */
  public GrammarParser forPath(String path) {
    String ext = extensionOf(path);
    GrammarParser parser = ext == null ? null : byExtension.get(ext);
    if (parser != null) return parser;
    return byId(defaultId)
        .orElseThrow(
            () ->
                new ConfigException(
                    "No grammar for '" + path + "' and default grammar '" + defaultId
                        + "' is not registered"));
  }

  private static String extensionOf(String path) {
    if (path == null) return null;
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    int dot = path.lastIndexOf('.');
    return dot > slash + 1 ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : null;
  }
}
