package com.gentoro.kerai.grammar;

import java.util.List;

/**
 * What a grammar hands to the extractor: the top-level units in source order, plus the line ranges
 * of string literals, inside which comment markers are not comments.
 */
public record SyntaxTree(String language, List<SyntaxUnit> units, List<LineSpan> stringSpans) {
  public SyntaxTree {
    units = units == null ? List.of() : List.copyOf(units);
    stringSpans = stringSpans == null ? List.of() : List.copyOf(stringSpans);
  }
}
