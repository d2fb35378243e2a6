package com.gentoro.kerai.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for Kerai with a stable {@link KeraiErrorCode} and optional context.
 *
 * <p>The context map is copied on construction and exposed read-only, so exceptions can be handed
 * across threads and logged later without surprises.
 */
public class KeraiException extends RuntimeException {
  private final KeraiErrorCode code;
  private final Map<String, Object> context;

  public KeraiException(KeraiErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public KeraiException(KeraiErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public KeraiException(KeraiErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public KeraiException(
      KeraiErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public KeraiErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
