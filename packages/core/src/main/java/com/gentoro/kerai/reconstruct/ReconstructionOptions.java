package com.gentoro.kerai.reconstruct;

/**
 * Per-call reconstruction options. A {@code null} field is unspecified and defers to the file's
 * stored flags, then to the system defaults.
 */
public record ReconstructionOptions(
    Boolean sortImports, Boolean orderDerives, Boolean suggestions) {

  /** Everything unspecified. */
  public static final ReconstructionOptions DEFAULTS = new ReconstructionOptions(null, null, null);

  /** Per-call equivalent of the {@code skip} flag: a byte-faithful reconstruction. */
  public static final ReconstructionOptions SKIP_ALL =
      new ReconstructionOptions(false, false, false);

  public static ReconstructionOptions all(boolean enabled) {
    return new ReconstructionOptions(enabled, enabled, enabled);
  }
}
