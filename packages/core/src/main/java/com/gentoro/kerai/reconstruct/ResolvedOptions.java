package com.gentoro.kerai.reconstruct;

/** The options a reconstruction actually runs with. */
public record ResolvedOptions(boolean sortImports, boolean orderDerives, boolean suggestions) {}
