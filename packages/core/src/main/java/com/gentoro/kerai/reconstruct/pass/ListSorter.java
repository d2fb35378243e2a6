package com.gentoro.kerai.reconstruct.pass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Helpers for the comma-separated lists both passes reorder. */
final class ListSorter {
  static final Comparator<String> CASE_INSENSITIVE =
      Comparator.comparing((String s) -> s.toLowerCase(Locale.ROOT))
          .thenComparing(Comparator.naturalOrder());

  private ListSorter() {}

  /** Index of the bracket closing the one at {@code open}, or -1. */
  static int matching(String s, int open) {
    char o = s.charAt(open);
    char c = o == '(' ? ')' : o == '{' ? '}' : ']';
    int depth = 0;
    for (int i = open; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == o) depth++;
      else if (ch == c && --depth == 0) return i;
    }
    return -1;
  }

  /** Split at commas outside nested brackets. Items are trimmed, empty items dropped. */
  static List<String> splitTopLevel(String s) {
    List<String> items = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '(' || ch == '{' || ch == '[' || ch == '<') depth++;
      else if (ch == ')' || ch == '}' || ch == ']' || ch == '>') depth--;
      else if (ch == ',' && depth == 0) {
        add(items, s.substring(start, i));
        start = i + 1;
      }
    }
    add(items, s.substring(start));
    return items;
  }

  private static void add(List<String> items, String raw) {
    String t = raw.trim();
    if (!t.isEmpty()) items.add(t);
  }
}
