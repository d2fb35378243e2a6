package com.gentoro.kerai.normalize;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonicalizes text before parsing and before comment extraction, so that line numbers agree
 * between the two passes.
 *
 * <p>The result has no byte-order mark, {@code \n} line terminators only, no trailing whitespace on
 * any line, no leading or trailing blank lines, at most one blank line in a row, and exactly one
 * final terminator. Input that is empty after these steps becomes the empty string. The function is
 * total and idempotent.
 */
public final class TextNormalizer {
  private static final char BOM = '\uFEFF';

  private TextNormalizer() {}

  public static String normalize(String text) {
    if (text == null || text.isEmpty()) return "";
    String s = text.charAt(0) == BOM ? text.substring(1) : text;
    s = s.replace("\r\n", "\n").replace('\r', '\n');

    StringBuilder out = new StringBuilder(s.length() + 1);
    boolean pendingBlank = false;
    boolean any = false;
    for (String raw : s.split("\n", -1)) {
      String line = stripTrailing(raw);
      if (line.isEmpty()) {
        pendingBlank = any;
        continue;
      }
      if (pendingBlank) out.append('\n');
      out.append(line).append('\n');
      pendingBlank = false;
      any = true;
    }
    return out.toString();
  }

  /** Split normalized text into lines without terminators. Line {@code i} is number {@code i+1}. */
  public static List<String> lines(String normalized) {
    List<String> lines = new ArrayList<>();
    if (normalized == null || normalized.isEmpty()) return lines;
    int start = 0;
    for (int i = 0; i < normalized.length(); i++) {
      if (normalized.charAt(i) == '\n') {
        lines.add(normalized.substring(start, i));
        start = i + 1;
      }
    }
    if (start < normalized.length()) lines.add(normalized.substring(start));
    return lines;
  }

  /** Join lines back into normalized form. */
  public static String join(List<String> lines) {
    if (lines.isEmpty()) return "";
    return String.join("\n", lines) + "\n";
  }

  private static String stripTrailing(String line) {
    int end = line.length();
    while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) end--;
    return line.substring(0, end);
  }
}
