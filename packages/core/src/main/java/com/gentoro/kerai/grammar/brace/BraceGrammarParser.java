package com.gentoro.kerai.grammar.brace;

import com.gentoro.kerai.grammar.GrammarParser;
import com.gentoro.kerai.grammar.SyntaxTree;
import com.gentoro.kerai.grammar.SyntaxUnit;
import com.gentoro.kerai.normalize.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Grammar for Rust-like brace-delimited sources.
 *
 * <p>A unit starts at the first line carrying code and ends once braces and brackets are balanced
 * again and the last code character seen is a semicolon or a closing brace. Attribute lines
 * therefore stay with the item that follows them. {@code impl}, {@code trait} and block {@code mod}
 * units whose opening line ends with an opening brace and whose last line starts with the closing
 * brace are containers, and their body is split the same way.
 */
public class BraceGrammarParser implements GrammarParser {
  public static final String ID = "rust";

  private static final Set<String> CONTAINER_KINDS = Set.of("impl", "trait", "mod");

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<String> extensions() {
    return Set.of("rs");
  }

  @Override
  public SyntaxTree parse(String fileName, String normalizedText) {
    List<String> lines = TextNormalizer.lines(normalizedText);
    BraceLexer.Lexed lexed = new BraceLexer(fileName, lines).lex();
    List<SyntaxUnit> units = new Segmenter(lines, lexed).segment(1, lines.size(), 0);
    return new SyntaxTree(ID, units, lexed.stringSpans);
  }

  private static final class Segmenter {
    private final List<String> lines;
    private final BraceLexer.Lexed lx;

    Segmenter(List<String> lines, BraceLexer.Lexed lx) {
      this.lines = lines;
      this.lx = lx;
    }

    List<SyntaxUnit> segment(int from, int to, int base) {
      List<SyntaxUnit> units = new ArrayList<>();
      int i = from;
      while (i <= to) {
        if (!lx.hasCode[i]) {
          i++;
          continue;
        }
        int start = i;
        // a block comment that opened on a comment-only line and ends before code on this line
        if (lx.startsInComment(i) && lx.commentOpenLine[i] >= from) {
          start = lx.commentOpenLine[i];
        }
        int end = findEnd(i, to, base);
        units.add(build(start, end, base));
        i = end + 1;
      }
      return units;
    }

    private int findEnd(int first, int to, int base) {
      char lastSig = 0;
      for (int j = first; j <= to; j++) {
        if (lx.lastCode[j] != 0) lastSig = lx.lastCode[j];
        boolean balanced =
            lx.depthEnd[j] == base
                && lx.nestEnd[j] == 0
                && !lx.endsInString[j]
                && !lx.endsInComment[j];
        if (!balanced) continue;
        if (lastSig == ';' || lastSig == '}') return j;
        String trimmed = lx.code[j].trim();
        if (j == first && trimmed.startsWith("#!") && trimmed.endsWith("]")) return j;
      }
      int last = to;
      while (last > first && lines.get(last - 1).isEmpty()) last--;
      return last;
    }

    private SyntaxUnit build(int start, int end, int base) {
      StringBuilder head = new StringBuilder();
      for (int j = start; j <= end; j++) head.append(lx.code[j]).append(' ');
      HeadClassifier.Head h = HeadClassifier.classify(head.toString());

      String first = lines.get(start - 1);
      int startCol = first.length() - first.stripLeading().length();
      int endCol = lines.get(end - 1).length();

      if (CONTAINER_KINDS.contains(h.kind())) {
        int open = openLine(start, end, base);
        if (open > 0) {
          List<SyntaxUnit> children = segment(open + 1, end - 1, base + 1);
          return new SyntaxUnit(
              h.kind(),
              h.name(),
              h.visibility(),
              start,
              startCol,
              end,
              endCol,
              open + 1,
              end - 1,
              children);
        }
      }
      return SyntaxUnit.leaf(h.kind(), h.name(), h.visibility(), start, startCol, end, endCol);
    }

    /** Line whose trailing brace opens the container body, or 0 for a non-container. */
    private int openLine(int start, int end, int base) {
      for (int j = start; j < end; j++) {
        if (lx.depthEnd[j] > base) {
          boolean opensHere =
              lx.depthEnd[j] == base + 1 && lx.code[j].stripTrailing().endsWith("{");
          boolean closesLast =
              lx.depthStart[end] == base + 1 && lx.code[end].trim().startsWith("}");
          return opensHere && closesLast ? j : 0;
        }
      }
      return 0;
    }
  }
}
