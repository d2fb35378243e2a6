package com.gentoro.kerai.exception;

import java.util.Map;

/** Structured view of an error for command-line output; {@code context} may be null. */
public record ErrorDetails(
    String type, String message, KeraiErrorCode code, Map<String, Object> context) {}
