package com.gentoro.kerai.grammar.brace;

import java.util.Set;

/** Derives kind hint, name and visibility from the code of an item, attributes included. */
final class HeadClassifier {
  record Head(String kind, String name, String visibility) {}

  private static final Set<String> QUALIFIERS = Set.of("default", "async", "unsafe");

  private HeadClassifier() {}

  static Head classify(String code) {
    Cursor c = new Cursor(code);
    c.skipSpace();
    if (c.startsWith("#!")) {
      return new Head("attribute", null, "");
    }
    while (c.startsWith("#[")) {
      c.skipBalanced('[', ']', 1);
      c.skipSpace();
    }

    String visibility = "";
    if (c.peekWord().equals("pub")) {
      int from = c.pos;
      c.word();
      c.skipSpace();
      if (c.peek() == '(') c.skipBalanced('(', ')', 0);
      visibility = code.substring(from, c.pos).replaceAll("\\s+", "");
      c.skipSpace();
    }

    while (true) {
      String w = c.peekWord();
      if (QUALIFIERS.contains(w)) {
        c.word();
      } else if (w.equals("const") && isFnQualifier(c)) {
        c.word();
      } else if (w.equals("extern") && !c.lookaheadWord(1).equals("crate")) {
        c.word();
        c.skipSpace();
        if (c.peek() == '"') c.skipBalanced('"', '"', 0);
        c.skipSpace();
        if (c.peek() == '{') return new Head("statement", null, visibility);
        continue;
      } else {
        break;
      }
      c.skipSpace();
    }

    String keyword = c.word();
    c.skipSpace();
    switch (keyword) {
      case "use":
        return new Head("use", usePath(c.rest()), visibility);
      case "fn":
        return new Head("fn", c.word(), visibility);
      case "struct":
      case "union":
        return new Head("struct", c.word(), visibility);
      case "enum":
        return new Head("enum", c.word(), visibility);
      case "trait":
        return new Head("trait", c.word(), visibility);
      case "type":
        return new Head("type_alias", c.word(), visibility);
      case "mod":
        return new Head("mod", c.word(), visibility);
      case "const":
        return new Head("const", c.word(), visibility);
      case "static":
        if (c.peekWord().equals("mut")) {
          c.word();
          c.skipSpace();
        }
        return new Head("static", c.word(), visibility);
      case "impl":
        return new Head("impl", implSelfType(c.rest()), visibility);
      case "extern":
        c.word();
        c.skipSpace();
        return new Head("extern_crate", c.word(), visibility);
      case "macro_rules":
        if (c.peek() == '!') {
          c.pos++;
          c.skipSpace();
          return new Head("macro_def", c.word(), visibility);
        }
        return new Head("statement", null, visibility);
      default:
        break;
    }
    if (!keyword.isEmpty()) {
      // path::to::macro! { ... }
      String last = keyword;
      while (c.startsWith("::")) {
        c.pos += 2;
        last = c.word();
      }
      c.skipSpace();
      if (c.peek() == '!') return new Head("macro_call", last, visibility);
    }
    return new Head("statement", null, visibility);
  }

  private static boolean isFnQualifier(Cursor c) {
    String next = c.lookaheadWord(1);
    return next.equals("fn") || next.equals("unsafe") || next.equals("async")
        || next.equals("extern");
  }

  private static String usePath(String rest) {
    int semi = rest.indexOf(';');
    String path = semi >= 0 ? rest.substring(0, semi) : rest;
    return path.replaceAll("\\s+", " ").replace(" ::", "::").replace(":: ", "::").trim();
  }

  static String implSelfType(String rest) {
    Cursor c = new Cursor(rest);
    c.skipSpace();
    if (c.peek() == '<') c.skipBalanced('<', '>', 0);
    String header = rest.substring(c.pos);
    int brace = header.indexOf('{');
    if (brace >= 0) header = header.substring(0, brace);
    int where = indexOfWord(header, "where");
    if (where >= 0) header = header.substring(0, where);
    int forAt = lastIndexOfWord(header, "for");
    if (forAt >= 0) header = header.substring(forAt + 3);
    header = header.trim();
    while (header.startsWith("&") || header.startsWith("dyn ") || header.startsWith("mut ")) {
      header = header.startsWith("&") ? header.substring(1).trim() : header.substring(4).trim();
    }
    int end = 0;
    while (end < header.length()
        && (BraceLexer.isIdentChar(header.charAt(end)) || header.charAt(end) == ':')) {
      end++;
    }
    String path = header.substring(0, end);
    int sep = path.lastIndexOf("::");
    String name = sep >= 0 ? path.substring(sep + 2) : path;
    return name.isEmpty() ? null : name;
  }

  private static int indexOfWord(String s, String word) {
    int from = 0;
    while (true) {
      int at = s.indexOf(word, from);
      if (at < 0) return -1;
      if (isWordAt(s, at, word)) return at;
      from = at + 1;
    }
  }

  private static int lastIndexOfWord(String s, String word) {
    int from = s.length();
    while (from >= 0) {
      int at = s.lastIndexOf(word, from);
      if (at < 0) return -1;
      if (isWordAt(s, at, word)) return at;
      from = at - 1;
    }
    return -1;
  }

  private static boolean isWordAt(String s, int at, String word) {
    boolean left = at == 0 || !BraceLexer.isIdentChar(s.charAt(at - 1));
    int after = at + word.length();
    boolean right = after >= s.length() || !BraceLexer.isIdentChar(s.charAt(after));
    return left && right;
  }

  private static final class Cursor {
    private final String s;
    private int pos;

    Cursor(String s) {
      this.s = s;
    }

    char peek() {
      return pos < s.length() ? s.charAt(pos) : 0;
    }

    boolean startsWith(String prefix) {
      return s.startsWith(prefix, pos);
    }

    void skipSpace() {
      while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
    }

    String word() {
      int from = pos;
      while (pos < s.length() && BraceLexer.isIdentChar(s.charAt(pos))) pos++;
      return s.substring(from, pos);
    }

    String peekWord() {
      int save = pos;
      String w = word();
      pos = save;
      return w;
    }

    /** The n-th word after the current one. */
    String lookaheadWord(int n) {
      int save = pos;
      word();
      String w = "";
      for (int k = 0; k < n; k++) {
        skipSpace();
        w = word();
      }
      pos = save;
      return w;
    }

    void skipBalanced(char open, char close, int offset) {
      pos += offset;
      int depth = 0;
      while (pos < s.length()) {
        char ch = s.charAt(pos++);
        if (open == close && ch == close && depth == 1) return;
        if (ch == open && (open != close || depth == 0)) {
          depth++;
        } else if (ch == close && --depth == 0) {
          return;
        }
      }
    }

    String rest() {
      return s.substring(pos);
    }
  }
}
