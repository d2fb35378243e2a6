package com.gentoro.kerai.comment;

import java.util.List;

/** Adjacent standalone comments that are emitted as one {@code comment_block} node. */
public record CommentGroup(List<RawComment> members) {
  public CommentGroup {
    if (members == null || members.isEmpty()) {
      throw new IllegalArgumentException("A comment group needs at least one comment");
    }
    members = List.copyOf(members);
  }

  public RawComment first() {
    return members.get(0);
  }

  public RawComment last() {
    return members.get(members.size() - 1);
  }

  public int startLine() {
    return first().startLine();
  }

  public int endLine() {
    return last().endLine();
  }

  public int col() {
    return first().startCol();
  }

  public int lineCount() {
    return endLine() - startLine() + 1;
  }
}
