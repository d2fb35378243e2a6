package com.gentoro.kerai.grammar;

/** Inclusive range of 1-based line numbers. */
public record LineSpan(int startLine, int endLine) {
  public LineSpan {
    if (startLine < 1 || endLine < startLine) {
      throw new IllegalArgumentException("Invalid line span " + startLine + ".." + endLine);
    }
  }

  public boolean isMultiLine() {
    return endLine > startLine;
  }

  public boolean contains(int line) {
    return line >= startLine && line <= endLine;
  }
}
