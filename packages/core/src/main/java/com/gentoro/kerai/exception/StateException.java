package com.gentoro.kerai.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends KeraiException {
  public StateException(String message) {
    super(KeraiErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(KeraiErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
