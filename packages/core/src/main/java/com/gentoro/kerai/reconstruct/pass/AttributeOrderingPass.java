package com.gentoro.kerai.reconstruct.pass;

import java.util.List;

/**
 * Sorts the value list of {@code #[derive(...)]} attributes case-insensitively. Each attribute is
 * sorted on its own; separate attributes on one item are never merged. Only single-line attributes
 * on attribute lines are touched.
 */
public class AttributeOrderingPass implements TextPass {
  private static final String DERIVE = "#[derive(";

  @Override
  public String apply(String text) {
    if (text == null || !text.contains(DERIVE)) return text;
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].trim().startsWith("#[")) lines[i] = orderLine(lines[i]);
    }
    return String.join("\n", lines);
  }

  static String orderLine(String line) {
    StringBuilder out = new StringBuilder();
    int from = 0;
    while (true) {
      int at = line.indexOf(DERIVE, from);
      if (at < 0) break;
      int open = at + DERIVE.length() - 1;
      int close = ListSorter.matching(line, open);
      if (close < 0) break;
      List<String> items = ListSorter.splitTopLevel(line.substring(open + 1, close));
      out.append(line, from, open + 1);
      if (items.isEmpty()) {
        out.append(line, open + 1, close);
      } else {
        items.sort(ListSorter.CASE_INSENSITIVE);
        out.append(String.join(", ", items));
      }
      from = close;
    }
    out.append(line.substring(from));
    return out.toString();
  }
}
