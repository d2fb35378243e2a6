package com.gentoro.kerai;

import com.gentoro.kerai.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line arguments in {@code --name value} form.
 *
 * <p>Recognized names: {@code mode} (ingest, reconstruct, status, help), {@code config-file},
 * {@code file} (source path to ingest, or logical path to reconstruct), {@code out} and
 * {@code peer}.
 */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("ingest", "reconstruct", "status", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "help");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[++p];
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }
    String cfg = parameters.get("config-file");
    if (cfg == null || cfg.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if (("ingest".equals(mode) || "reconstruct".equals(mode)) && parameters.get("file") == null) {
      throw new ValidationException("Mode '" + mode + "' requires --file");
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  public String configFile() {
    return parameters.get("config-file");
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
