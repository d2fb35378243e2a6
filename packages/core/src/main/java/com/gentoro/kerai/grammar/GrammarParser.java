package com.gentoro.kerai.grammar;

import com.gentoro.kerai.exception.GrammarParseException;
import java.util.Set;

/** Turns normalized source text into a {@link SyntaxTree}. Implementations must be stateless. */
public interface GrammarParser {
  /** Grammar id used in configuration, e.g. {@code rust}. */
  String id();

  /** File extensions, without the dot, this grammar claims. */
  Set<String> extensions();

  /**
   * Parse normalized text.
   *
   * @throws GrammarParseException when the input is malformed for this grammar
   */
  SyntaxTree parse(String fileName, String normalizedText);
}
