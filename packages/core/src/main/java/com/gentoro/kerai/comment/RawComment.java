package com.gentoro.kerai.comment;

/**
 * One physical comment. Lines are 1-based; {@code startCol} is 0-based and {@code endCol} is the
 * exclusive end column on {@code endLine}.
 */
public record RawComment(
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    CommentStyle style,
    boolean doc,
    boolean inner) {

  /** Two comments sharing a line become one compound block that never groups with others. */
  RawComment mergeWith(RawComment next) {
    return new RawComment(
        startLine,
        startCol,
        next.endLine,
        next.endCol,
        CommentStyle.BLOCK,
        doc && next.doc,
        inner && next.inner);
  }
}
