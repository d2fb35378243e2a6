package com.gentoro.kerai.grammar;

import java.util.List;
import java.util.Objects;

/**
 * One syntactic unit reported by a grammar.
 *
 * <p>Lines are 1-based and inclusive, columns are 0-based. A container unit (an {@code impl} block,
 * say) has a body range and nested children; its header runs from {@code startLine} to {@code
 * bodyStartLine - 1} and its closing line is {@code endLine}. For leaf units {@code bodyStartLine}
 * and {@code bodyEndLine} are zero.
 */
public record SyntaxUnit(
    String kindHint,
    String name,
    String visibility,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    int bodyStartLine,
    int bodyEndLine,
    List<SyntaxUnit> children) {

  public SyntaxUnit {
    Objects.requireNonNull(kindHint, "kindHint");
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static SyntaxUnit leaf(
      String kindHint,
      String name,
      String visibility,
      int startLine,
      int startCol,
      int endLine,
      int endCol) {
    return new SyntaxUnit(
        kindHint, name, visibility, startLine, startCol, endLine, endCol, 0, 0, List.of());
  }

  public boolean isContainer() {
    return bodyStartLine > 0;
  }

  public boolean isPublic() {
    return visibility != null && !visibility.isEmpty();
  }
}
