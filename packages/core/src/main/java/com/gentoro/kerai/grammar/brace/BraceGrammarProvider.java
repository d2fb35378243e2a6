package com.gentoro.kerai.grammar.brace;

import com.gentoro.kerai.grammar.GrammarParser;
import com.gentoro.kerai.grammar.spi.GrammarProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the built-in {@code rust} grammar. */
public class BraceGrammarProvider implements GrammarProvider {
  @Override
  public String id() {
    return BraceGrammarParser.ID;
  }

  @Override
  public GrammarParser create(Configuration configuration) {
    return new BraceGrammarParser();
  }
}
