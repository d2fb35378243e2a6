package com.gentoro.kerai.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input could not be parsed into a syntax tree. Aborts extraction of the whole file; nothing from
 * the file is committed.
 */
public class GrammarParseException extends KeraiException {
  public GrammarParseException(String message) {
    super(KeraiErrorCode.PARSE_ERROR, message);
  }

  public GrammarParseException(String message, Throwable cause) {
    super(KeraiErrorCode.PARSE_ERROR, message, cause);
  }

  public GrammarParseException(String message, Map<String, ?> context) {
    super(KeraiErrorCode.PARSE_ERROR, message, context);
  }

  /** Failure located at a 1-based line and 0-based column of {@code file}. */
  public static GrammarParseException at(String file, int line, int column, String message) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("file", file);
    ctx.put("line", line);
    ctx.put("column", column);
    return new GrammarParseException(
        message + " at " + file + ":" + line + ":" + (column + 1), ctx);
  }

  public Integer getLine() {
    Object v = getContext().get("line");
    return v instanceof Integer i ? i : null;
  }
}
