package com.gentoro.kerai.exception;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or CLI output. If the
   * throwable is a {@link KeraiException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof KeraiException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        KeraiErrorCode.UNKNOWN,
        null);
  }

  /**
   * Render an error as a single line, {@code Type[CODE]: message {context}}, for command-line
   * reporting.
   */
  public static String describe(Throwable t) {
    if (t == null) return "Unknown error";
    ErrorDetails d = toErrorDetails(t);
    StringBuilder sb = new StringBuilder(d.type()).append('[').append(d.code()).append(']');
    if (!d.message().isEmpty()) sb.append(": ").append(d.message());
    if (d.context() != null && !d.context().isEmpty()) sb.append(' ').append(d.context());
    return sb.toString();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
