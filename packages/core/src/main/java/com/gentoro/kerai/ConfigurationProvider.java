package com.gentoro.kerai;

import com.gentoro.kerai.exception.ConfigException;
import com.gentoro.kerai.exception.SerializationException;
import com.gentoro.kerai.logging.LoggingService;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration and exposes it as an Apache Commons {@link Configuration}.
 *
 * <p>Supported locations:
 *
 * <ul>
 *   <li>{@code classpath:application.yaml}
 *   <li>{@code file:/etc/kerai.yaml}
 *   <li>a plain absolute or relative filesystem path
 * </ul>
 *
 * Values may reference environment variables with {@code ${env:NAME}}; when a variable is not set
 * the lookup falls back to a {@code .env.local} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Wrap an already built configuration, mostly for tests. */
  public ConfigurationProvider(Configuration configuration) {
    this.configuration = addOns(configuration);
  }

  public Configuration config() {
    return configuration;
  }

  public String peerId() {
    String id = configuration.getString("kerai.peer.id", "");
    if (id == null || id.isBlank()) {
      throw new ConfigException("Missing required configuration key 'kerai.peer.id'");
    }
    return id.trim();
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream input = cl.getResourceAsStream(resourceName)) {
      if (input == null) {
        log.warn("Configuration resource {} not found on classpath; using defaults", resourceName);
        return addOns(new YAMLConfiguration());
      }
      log.info("Loading configuration from classpath resource: {}", resourceName);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(new String(input.readAllBytes(), StandardCharsets.UTF_8)));
      return addOns(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = Paths.get(".env.local");
            fallback = Files.exists(path) ? readKeyValueFile(path) : new HashMap<>();
          }
        }
      }
      return fallback.get(key);
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .filter(line -> line.indexOf('=') > 0)
            .collect(
                Collectors.toMap(
                    line -> line.substring(0, line.indexOf('=')).trim(),
                    line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                    (a, b) -> b));
      } catch (IOException e) {
        log.warn("Failed to read {}; ignoring fallback environment", path, e);
        return Collections.emptyMap();
      }
    }

    private static String unquote(String val) {
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        return val.substring(1, val.length() - 1);
      }
      return val;
    }
  }
}
