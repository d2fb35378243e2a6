package com.gentoro.kerai.suggest;

/** A pending suggestion as the assembler renders it. */
public record SuggestionText(String ruleId, String message) {
  public AdvisoryMarker marker() {
    return new AdvisoryMarker(ruleId, message);
  }
}
