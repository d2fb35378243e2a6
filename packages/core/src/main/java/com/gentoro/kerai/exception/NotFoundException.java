package com.gentoro.kerai.exception;

/** Resource requested was not found. */
public class NotFoundException extends KeraiException {
  public NotFoundException(String message) {
    super(KeraiErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(KeraiErrorCode.NOT_FOUND, message, cause);
  }
}
