package com.gentoro.kerai.comment;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges runs of line comments into groups: same column, consecutive lines, same doc and inner
 * flags. Block comments always stand alone.
 */
public class CommentGrouper {

  /** Groups {@code comments}, which must be standalone and ordered by line. */
  public List<CommentGroup> group(List<RawComment> comments) {
    List<CommentGroup> groups = new ArrayList<>();
    List<RawComment> current = new ArrayList<>();
    for (RawComment c : comments) {
      if (!current.isEmpty() && !continues(current.get(current.size() - 1), c)) {
        groups.add(new CommentGroup(current));
        current = new ArrayList<>();
      }
      current.add(c);
    }
    if (!current.isEmpty()) groups.add(new CommentGroup(current));
    return groups;
  }

  static boolean continues(RawComment prev, RawComment next) {
    return prev.style() == CommentStyle.LINE
        && next.style() == CommentStyle.LINE
        && prev.startCol() == next.startCol()
        && next.startLine() == prev.endLine() + 1
        && prev.doc() == next.doc()
        && prev.inner() == next.inner();
  }
}
