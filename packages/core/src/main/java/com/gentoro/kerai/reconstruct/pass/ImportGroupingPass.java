package com.gentoro.kerai.reconstruct.pass;

import com.gentoro.kerai.graph.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Groups and sorts the top-level imports of a file.
 *
 * <p>Groups come out in this order, one blank line apart: standard library ({@code std},
 * {@code core}, {@code alloc}), external crates, then crate-internal paths ({@code crate},
 * {@code self}, {@code super}). Within a group imports sort case-insensitively by path, ignoring
 * attributes and visibility. Exact duplicates keep their first occurrence. Nested brace lists are
 * sorted in place by {@link #apply(String)}.
 */
public class ImportGroupingPass implements TextPass {

  public enum ImportGroup {
    STD,
    EXTERNAL,
    INTERNAL
  }

  /** One import together with whatever travels with it. */
  public record Entry<T>(Node node, String sortKey, ImportGroup group, T payload) {}

  /** Sort and dedupe; the result holds one list per non-empty group, in group order. */
  public <T> List<List<Entry<T>>> arrange(List<Entry<T>> imports) {
    List<List<Entry<T>>> groups = new ArrayList<>();
    for (ImportGroup g : ImportGroup.values()) {
      Set<String> seen = new HashSet<>();
      List<Entry<T>> members = new ArrayList<>();
      for (Entry<T> e : imports) {
        if (e.group() == g && seen.add(e.sortKey())) members.add(e);
      }
      members.sort(Comparator.comparing(Entry::sortKey));
      if (!members.isEmpty()) groups.add(members);
    }
    return groups;
  }

  public <T> Entry<T> entry(Node node, T payload) {
    String key = sortKey(node.getContent());
    return new Entry<>(node, key, groupOf(key), payload);
  }

  /** Sort nested {@code {a, b}} lists of a single-line import. */
  @Override
  public String apply(String text) {
    if (text == null) return null;
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String t = lines[i].trim();
      if (!t.startsWith("#[") && t.contains("use ")) lines[i] = sortBraces(lines[i]);
    }
    return String.join("\n", lines);
  }

  static String sortKey(String content) {
    StringBuilder path = new StringBuilder();
    for (String line : (content == null ? "" : content).split("\n")) {
      String t = line.trim();
      if (t.isEmpty() || t.startsWith("#[")) continue;
      if (path.length() > 0) path.append(' ');
      path.append(t);
    }
    String s = path.toString();
    if (s.startsWith("pub(")) {
      int close = s.indexOf(')');
      s = close < 0 ? s : s.substring(close + 1).trim();
    } else if (s.startsWith("pub ")) {
      s = s.substring(4).trim();
    }
    if (s.startsWith("use ")) s = s.substring(4);
    s = s.replaceAll("\\s*::\\s*", "::").replaceAll("\\s+", " ").trim();
    while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
    if (s.startsWith("::")) s = s.substring(2);
    return s.toLowerCase(Locale.ROOT);
  }

  static ImportGroup groupOf(String sortKey) {
    int end = 0;
    while (end < sortKey.length()
        && (Character.isLetterOrDigit(sortKey.charAt(end)) || sortKey.charAt(end) == '_')) {
      end++;
    }
    switch (sortKey.substring(0, end)) {
      case "std":
      case "core":
      case "alloc":
        return ImportGroup.STD;
      case "crate":
      case "self":
      case "super":
        return ImportGroup.INTERNAL;
      default:
        return ImportGroup.EXTERNAL;
    }
  }

  static String sortBraces(String line) {
    int open = line.indexOf('{');
    if (open < 0) return line;
    int close = ListSorter.matching(line, open);
    if (close < 0) return line;
    String inner = line.substring(open + 1, close);
    String pad = inner.startsWith(" ") ? " " : "";
    List<String> items = new ArrayList<>();
    for (String item : ListSorter.splitTopLevel(inner)) {
      items.add(item.indexOf('{') >= 0 ? sortBraces(item) : item);
    }
    if (items.size() < 2 && items.stream().noneMatch(i -> i.indexOf('{') >= 0)) return line;
    items.sort(ListSorter.CASE_INSENSITIVE);
    return line.substring(0, open + 1)
        + pad
        + String.join(", ", items)
        + pad
        + line.substring(close);
  }
}
