package com.gentoro.kerai.comment;

import com.gentoro.kerai.grammar.LineSpan;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds {@code //} and {@code /* *}{@code /} comments in normalized text.
 *
 * <p>String and character literals on a line are skipped, and lines inside multi-line string
 * literals reported by the grammar are not scanned at all: the opening line of such a span is
 * scanned up to the literal, the following lines through the closing one are excluded. Block
 * comments nest.
 */
public class CommentScanner {

  public List<RawComment> scan(List<String> lines, List<LineSpan> stringSpans) {
    List<RawComment> out = new ArrayList<>();
    int blockDepth = 0;
    int blockLine = 0;
    int blockCol = 0;
    boolean blockDoc = false;
    boolean blockInner = false;

    for (int ln = 1; ln <= lines.size(); ln++) {
      if (blockDepth == 0 && isExcluded(ln, stringSpans)) continue;
      String line = lines.get(ln - 1);
      int len = line.length();
      int i = 0;
      while (i < len) {
        char c = line.charAt(i);
        char next = i + 1 < len ? line.charAt(i + 1) : 0;
        if (blockDepth > 0) {
          if (c == '/' && next == '*') {
            blockDepth++;
            i += 2;
          } else if (c == '*' && next == '/') {
            i += 2;
            if (--blockDepth == 0) {
              out.add(
                  new RawComment(
                      blockLine, blockCol, ln, i, CommentStyle.BLOCK, blockDoc, blockInner));
            }
          } else {
            i++;
          }
          continue;
        }
        if (c == '/' && next == '/') {
          String rest = line.substring(i);
          boolean inner = rest.startsWith("//!");
          boolean doc = inner || (rest.startsWith("///") && !rest.startsWith("////"));
          out.add(new RawComment(ln, i, ln, len, CommentStyle.LINE, doc, inner));
          break;
        }
        if (c == '/' && next == '*') {
          String rest = line.substring(i);
          blockInner = rest.startsWith("/*!");
          blockDoc =
              blockInner
                  || (rest.startsWith("/**")
                      && !rest.startsWith("/***")
                      && !rest.startsWith("/**/"));
          blockDepth = 1;
          blockLine = ln;
          blockCol = i;
          i += 2;
          continue;
        }
        i = skipLiteral(line, i);
      }
    }
    return out;
  }

  /** A line after the first line of a multi-line string span, through its last line. */
  static boolean isExcluded(int line, List<LineSpan> spans) {
    for (LineSpan s : spans) {
      if (s.startLine() != s.endLine() && line > s.startLine() && line <= s.endLine()) return true;
    }
    return false;
  }

  /** Index after the literal or code character at {@code i}. Unclosed strings run to line end. */
  private static int skipLiteral(String line, int i) {
    int len = line.length();
    char c = line.charAt(i);
    int raw = rawStringBody(line, i);
    if (raw >= 0) {
      int hashes = raw - i - 1 - (line.charAt(i) == 'b' ? 2 : 1);
      String close = "\"" + "#".repeat(hashes);
      int end = line.indexOf(close, raw);
      return end < 0 ? len : end + close.length();
    }
    if (c == '"') {
      int j = i + 1;
      while (j < len) {
        char d = line.charAt(j);
        if (d == '\\') {
          j += 2;
        } else if (d == '"') {
          return j + 1;
        } else {
          j++;
        }
      }
      return len;
    }
    if (c == '\'' && i + 1 < len) {
      if (line.charAt(i + 1) == '\\') {
        int j = i + 3;
        while (j < len && line.charAt(j) != '\'') j++;
        return j < len ? j + 1 : i + 1;
      }
      if (i + 2 < len && line.charAt(i + 2) == '\'') return i + 3;
    }
    return i + 1;
  }

  /** Index just past the opening quote of a raw string literal at {@code i}, or -1. */
  private static int rawStringBody(String line, int i) {
    if (i > 0 && (Character.isLetterOrDigit(line.charAt(i - 1)) || line.charAt(i - 1) == '_')) {
      return -1;
    }
    int j = i;
    if (j < line.length() && line.charAt(j) == 'b') j++;
    if (j >= line.length() || line.charAt(j) != 'r') return -1;
    j++;
    while (j < line.length() && line.charAt(j) == '#') j++;
    return j < line.length() && line.charAt(j) == '"' ? j + 1 : -1;
  }
}
