package com.gentoro.kerai.grammar.brace;

import com.gentoro.kerai.exception.GrammarParseException;
import com.gentoro.kerai.grammar.LineSpan;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented lexical pass over brace-delimited source.
 *
 * <p>Records per line whether it carries code, its last code character, brace and bracket depth at
 * the line boundaries, and whether a string literal or block comment is still open at its end.
 * Comments are dropped from {@link Lexed#code}; string bodies are reduced to their quotes.
 */
final class BraceLexer {
  private enum State {
    CODE,
    STRING,
    RAW_STRING,
    BLOCK_COMMENT
  }

  /** Lexical facts, indexed by 1-based line number. */
  static final class Lexed {
    final int lineCount;
    final boolean[] hasCode;
    final char[] lastCode;
    final String[] code;
    final int[] depthStart;
    final int[] depthEnd;
    final int[] nestEnd;
    final boolean[] endsInString;
    final boolean[] endsInComment;
    final int[] commentOpenLine;
    final List<LineSpan> stringSpans = new ArrayList<>();

    Lexed(int n) {
      lineCount = n;
      hasCode = new boolean[n + 1];
      lastCode = new char[n + 1];
      code = new String[n + 1];
      depthStart = new int[n + 1];
      depthEnd = new int[n + 1];
      nestEnd = new int[n + 1];
      endsInString = new boolean[n + 1];
      endsInComment = new boolean[n + 1];
      commentOpenLine = new int[n + 1];
    }

    boolean startsInComment(int line) {
      return line > 1 && endsInComment[line - 1];
    }
  }

  private final String fileName;
  private final List<String> lines;

  private State state = State.CODE;
  private int depth;
  private int nest;
  private int commentDepth;
  private int rawHashes;
  private int openLine;
  private int openCol;

  BraceLexer(String fileName, List<String> lines) {
    this.fileName = fileName;
    this.lines = lines;
  }

  Lexed lex() {
    Lexed out = new Lexed(lines.size());
    for (int ln = 1; ln <= lines.size(); ln++) {
      lexLine(ln, lines.get(ln - 1), out);
    }
    if (state == State.STRING || state == State.RAW_STRING) {
      throw GrammarParseException.at(fileName, openLine, openCol, "Unterminated string literal");
    }
    if (state == State.BLOCK_COMMENT) {
      throw GrammarParseException.at(fileName, openLine, openCol, "Unterminated block comment");
    }
    return out;
  }

  private void lexLine(int ln, String line, Lexed out) {
    StringBuilder code = new StringBuilder(line.length());
    boolean hasCode = state == State.STRING || state == State.RAW_STRING;
    char last = 0;
    out.depthStart[ln] = depth;
    if (state == State.BLOCK_COMMENT) out.commentOpenLine[ln] = openLine;

    int i = 0;
    int len = line.length();
    while (i < len) {
      char c = line.charAt(i);
      char next = i + 1 < len ? line.charAt(i + 1) : 0;
      switch (state) {
        case BLOCK_COMMENT -> {
          if (c == '/' && next == '*') {
            commentDepth++;
            i += 2;
          } else if (c == '*' && next == '/') {
            i += 2;
            if (--commentDepth == 0) {
              state = State.CODE;
              code.append(' ');
            }
          } else {
            i++;
          }
        }
        case STRING -> {
          if (c == '\\') {
            i += 2;
          } else if (c == '"') {
            closeString(ln, out);
            code.append('"');
            last = '"';
            i++;
          } else {
            i++;
          }
        }
        case RAW_STRING -> {
          if (c == '"' && hashesFollow(line, i + 1, rawHashes)) {
            closeString(ln, out);
            code.append('"');
            last = '"';
            i += 1 + rawHashes;
          } else {
            i++;
          }
        }
        case CODE -> {
          if (c == '/' && next == '/') {
            i = len;
            continue;
          }
          if (c == '/' && next == '*') {
            state = State.BLOCK_COMMENT;
            commentDepth = 1;
            openLine = ln;
            openCol = i;
            i += 2;
            continue;
          }
          int raw = rawStringStart(line, i);
          if (raw >= 0) {
            state = State.RAW_STRING;
            openLine = ln;
            openCol = i;
            code.append('"');
            hasCode = true;
            last = '"';
            i = raw;
            continue;
          }
          if (c == '"') {
            state = State.STRING;
            openLine = ln;
            openCol = i;
            code.append('"');
            hasCode = true;
            last = '"';
            i++;
            continue;
          }
          if (c == '\'') {
            int end = charLiteralEnd(line, i);
            if (end > 0) {
              code.append("' '");
              hasCode = true;
              last = '\'';
              i = end;
              continue;
            }
          }
          switch (c) {
            case '{' -> depth++;
            case '}' -> {
              if (--depth < 0) {
                throw GrammarParseException.at(fileName, ln, i, "Unbalanced closing brace");
              }
            }
            case '(', '[' -> nest++;
            case ')', ']' -> nest = Math.max(0, nest - 1);
            default -> {}
          }
          code.append(c);
          if (!Character.isWhitespace(c)) {
            hasCode = true;
            last = c;
          }
          i++;
        }
      }
    }

    out.hasCode[ln] = hasCode;
    out.lastCode[ln] = last;
    out.code[ln] = code.toString();
    out.depthEnd[ln] = depth;
    out.nestEnd[ln] = nest;
    out.endsInString[ln] = state == State.STRING || state == State.RAW_STRING;
    out.endsInComment[ln] = state == State.BLOCK_COMMENT;
    if (state == State.BLOCK_COMMENT && out.commentOpenLine[ln] == 0) {
      out.commentOpenLine[ln] = openLine;
    }
  }

  private void closeString(int ln, Lexed out) {
    state = State.CODE;
    if (ln > openLine) out.stringSpans.add(new LineSpan(openLine, ln));
  }

  /** Index just past the opening quote of a raw string starting at {@code i}, or -1. */
  private int rawStringStart(String line, int i) {
    if (i > 0 && isIdentChar(line.charAt(i - 1))) return -1;
    int j = i;
    if (j < line.length() && line.charAt(j) == 'b') j++;
    if (j >= line.length() || line.charAt(j) != 'r') return -1;
    j++;
    int hashes = 0;
    while (j < line.length() && line.charAt(j) == '#') {
      hashes++;
      j++;
    }
    if (j >= line.length() || line.charAt(j) != '"') return -1;
    rawHashes = hashes;
    return j + 1;
  }

  private static boolean hashesFollow(String line, int from, int count) {
    if (from + count > line.length()) return false;
    for (int k = 0; k < count; k++) {
      if (line.charAt(from + k) != '#') return false;
    }
    return true;
  }

  /** End index (exclusive) of a char literal at {@code i}, or -1 for a lifetime. */
  private static int charLiteralEnd(String line, int i) {
    int len = line.length();
    if (i + 1 >= len) return -1;
    char first = line.charAt(i + 1);
    if (first == '\\') {
      int j = i + 3;
      while (j < len && line.charAt(j) != '\'') j++;
      return j < len ? j + 1 : -1;
    }
    if (i + 2 < len && line.charAt(i + 2) == '\'') return i + 3;
    if (Character.isHighSurrogate(first) && i + 3 < len && line.charAt(i + 3) == '\'') {
      return i + 4;
    }
    return -1;
  }

  static boolean isIdentChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
