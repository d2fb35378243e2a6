package com.gentoro.kerai.graph;

import java.util.Locale;

/** Where a comment group sits relative to its nearest structural neighbor. */
public enum Placement {
  ABOVE,
  TRAILING,
  BETWEEN,
  EOF;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Placement fromWire(String value) {
    if (value == null) return EOF;
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return EOF;
    }
  }
}
