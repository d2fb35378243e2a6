package com.gentoro.kerai.extract;

import java.util.List;

/**
 * A run of lines whose structural units share one owner: the whole file for the root, or the body
 * of a container. {@code toLine} may be smaller than {@code fromLine} for an empty body.
 */
public record Region(String ownerId, int fromLine, int toLine, List<String> unitIds) {
  public Region {
    unitIds = List.copyOf(unitIds);
  }

  public boolean isEmpty() {
    return toLine < fromLine;
  }
}
