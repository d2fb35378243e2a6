package com.gentoro.kerai.suggest;

import java.util.Locale;

public enum SuggestionStatus {
  EMITTED,
  DISMISSED,
  APPLIED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SuggestionStatus fromWire(String value) {
    return value == null ? EMITTED : valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
