package com.gentoro.kerai.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-file reconstruction flags, persisted as the {@code kerai_flags} map on the file root node.
 */
public record FileFlags(
    boolean skipSortImports, boolean skipOrderDerives, boolean skipSuggestions, boolean skipAll) {

  public static final FileFlags NONE = new FileFlags(false, false, false, false);
  public static final FileFlags SKIP_ALL = new FileFlags(false, false, false, true);

  public boolean suggestionsDisabled() {
    return skipAll || skipSuggestions;
  }

  public boolean isEmpty() {
    return !skipSortImports && !skipOrderDerives && !skipSuggestions && !skipAll;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("skip_sort_imports", skipSortImports);
    m.put("skip_order_derives", skipOrderDerives);
    m.put("skip_suggestions", skipSuggestions);
    m.put("skip_all", skipAll);
    return m;
  }

  /** Read the flags from a file root node. Missing flags are {@code false}. */
  public static FileFlags of(Node root) {
    if (root == null) return NONE;
    Object raw = root.getMetadata().get(MetaKeys.FLAGS);
    if (!(raw instanceof Map<?, ?> m)) return NONE;
    return new FileFlags(
        flag(m, "skip_sort_imports"),
        flag(m, "skip_order_derives"),
        flag(m, "skip_suggestions"),
        flag(m, "skip_all"));
  }

  private static boolean flag(Map<?, ?> m, String key) {
    Object v = m.get(key);
    return v instanceof Boolean b ? b : v != null && Boolean.parseBoolean(v.toString());
  }
}
