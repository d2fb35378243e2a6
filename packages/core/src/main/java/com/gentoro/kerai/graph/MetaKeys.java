package com.gentoro.kerai.graph;

/** Metadata keys shared by the extractor, the comment pipeline, the assembler and the rules. */
public final class MetaKeys {
  // spans
  public static final String START_LINE = "start_line";
  public static final String END_LINE = "end_line";
  public static final String START_COL = "start_col";
  public static final String END_COL = "end_col";
  public static final String COL = "col";

  // structural units
  public static final String NAME = "name";
  public static final String VISIBILITY = "visibility";
  public static final String CONTENT_HASH = "content_hash";
  public static final String BLANK_BEFORE = "blank_before";
  public static final String FOOTER = "footer";
  public static final String BLANK_BEFORE_FOOTER = "blank_before_footer";

  // comments
  public static final String PLACEMENT = "placement";
  public static final String STYLE = "style";
  public static final String DOC = "doc";
  public static final String INNER = "inner";
  public static final String LINE_COUNT = "line_count";
  public static final String GAP = "gap";

  // file roots
  public static final String PATH = "path";
  public static final String LANGUAGE = "language";
  public static final String FLAGS = "kerai_flags";

  // suggestions
  public static final String STATUS = "status";
  public static final String RULE = "rule";
  public static final String TARGET_ID = "target_id";
  public static final String TARGET_HASH = "target_hash";
  public static final String MESSAGE = "message";

  private MetaKeys() {}
}
