package com.gentoro.kerai;

import com.gentoro.kerai.exception.ExceptionUtil;
import com.gentoro.kerai.exception.IoException;
import com.gentoro.kerai.ingest.IngestResult;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.query.GraphQueryService;
import com.gentoro.kerai.reconstruct.ReconstructionOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

public class KeraiApp {
  private static final Logger log = LoggingService.getLogger(KeraiApp.class);

  private static final String USAGE =
      String.join(
          "\n",
          "usage: kerai --mode <ingest|reconstruct|status|help> [options]",
          "  --config-file <location>  classpath:, file: or plain path",
          "                            (default classpath:application.yaml)",
          "  --file <path>             file to ingest, or path to reconstruct",
          "  --peer <id>               overrides kerai.peer.id",
          "  --out <path>              write reconstructed text here instead of stdout",
          "  --skip                    reconstruct without normalization passes or markers");

  public static void main(String[] args) {
    try {
      System.exit(run(new StartupParameters(args)));
    } catch (Exception e) {
      log.error("kerai failed: {}", ExceptionUtil.describe(e));
      log.debug("Failure detail", e);
      System.exit(1);
    }
  }

  static int run(StartupParameters params) {
    if ("help".equals(params.mode())) {
      System.out.println(USAGE);
      return 0;
    }
    ConfigurationProvider provider = new ConfigurationProvider(params.configFile());
    params.get("peer").ifPresent(peer -> provider.config().setProperty("kerai.peer.id", peer));
    try (Kerai kerai = new Kerai(provider).initialize()) {
      switch (params.mode()) {
        case "ingest":
          return ingest(kerai, params.get("file").orElseThrow());
        case "reconstruct":
          return reconstruct(kerai, params);
        case "status":
          GraphQueryService.Status status = kerai.query().status();
          System.out.printf(
              "files=%d nodes=%d edges=%d operations=%d peers=%s%n",
              status.files(),
              status.nodes(),
              status.edges(),
              status.operations(),
              status.versionVector());
          return 0;
        default:
          System.out.println(USAGE);
          return 2;
      }
    }
  }

  private static int ingest(Kerai kerai, String file) {
    String text;
    try {
      text = Files.readString(Path.of(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read " + file, e);
    }
    IngestResult result = kerai.ingest().ingest(file, text);
    System.out.printf(
        "%s: %d nodes, %d edges, %d operations, %d suggestions%n",
        result.path(),
        result.nodes(),
        result.edges(),
        result.operations(),
        result.suggestionsEmitted());
    return 0;
  }

  private static int reconstruct(Kerai kerai, StartupParameters params) {
    ReconstructionOptions options =
        params.isParameterPresent("skip")
            ? ReconstructionOptions.SKIP_ALL
            : ReconstructionOptions.DEFAULTS;
    String file = params.get("file").orElseThrow();
    String text = kerai.reconstruction().reconstructPath(file, options);
    if (params.get("out").isEmpty()) {
      System.out.print(text);
      return 0;
    }
    Path out = Path.of(params.get("out").get());
    try {
      Files.writeString(out, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write " + out, e);
    }
    log.info("Wrote {}", out);
    return 0;
  }
}
