package com.gentoro.kerai.reconstruct;

import com.gentoro.kerai.graph.FileFlags;
import org.apache.commons.configuration2.Configuration;

/** Resolves options in priority order: explicit per call, then per-file flags, then defaults. */
public class OptionResolver {
  private final ResolvedOptions defaults;

  public OptionResolver(ResolvedOptions defaults) {
    this.defaults = defaults;
  }

  public static OptionResolver fromConfiguration(Configuration cfg) {
    return new OptionResolver(
        new ResolvedOptions(
            cfg.getBoolean("kerai.reconstruct.sort-imports", true),
            cfg.getBoolean("kerai.reconstruct.order-derives", true),
            cfg.getBoolean("kerai.reconstruct.suggestions", true)));
  }

  public ResolvedOptions resolve(ReconstructionOptions call, FileFlags flags) {
    ReconstructionOptions c = call == null ? ReconstructionOptions.DEFAULTS : call;
    FileFlags f = flags == null ? FileFlags.NONE : flags;
    return new ResolvedOptions(
        pick(c.sortImports(), f.skipAll() || f.skipSortImports(), defaults.sortImports()),
        pick(c.orderDerives(), f.skipAll() || f.skipOrderDerives(), defaults.orderDerives()),
        pick(c.suggestions(), f.suggestionsDisabled(), defaults.suggestions()));
  }

  private static boolean pick(Boolean explicit, boolean skippedByFile, boolean systemDefault) {
    if (explicit != null) return explicit;
    return !skippedByFile && systemDefault;
  }
}
