package com.gentoro.kerai.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends KeraiException {
  public ValidationException(String message) {
    super(KeraiErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(KeraiErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
