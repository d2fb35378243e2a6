package com.gentoro.kerai.extract;

import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.utility.HashUtility;

/**
 * Deterministic node ids. Re-parsing an unchanged file yields the same ids, which is what lets a
 * re-ingest be expressed as a small diff instead of a full replacement.
 */
public final class NodeIds {
  private NodeIds() {}

  public static String file(String path) {
    return HashUtility.stableId(NodeKinds.FILE, path);
  }

  /** Id of the {@code ordinal}-th unit with this kind and name under {@code parentId}. */
  public static String unit(String parentId, String kind, String name, int ordinal) {
    return HashUtility.stableId(
        parentId, kind, name == null ? "" : name, Integer.toString(ordinal));
  }

  public static String comment(String parentId, int ordinal) {
    return HashUtility.stableId(parentId, NodeKinds.COMMENT_BLOCK, Integer.toString(ordinal));
  }

  public static String trailingComment(String targetId) {
    return HashUtility.stableId(targetId, NodeKinds.COMMENT_BLOCK, "trailing");
  }

  public static String suggestion(String fileId, String ruleId, String targetId) {
    return HashUtility.stableId(fileId, NodeKinds.SUGGESTION, ruleId, targetId);
  }
}
