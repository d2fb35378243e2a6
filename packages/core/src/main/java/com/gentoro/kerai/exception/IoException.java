package com.gentoro.kerai.exception;

/** I/O operation failed (filesystem, classpath, streams). */
public class IoException extends KeraiException {
  public IoException(String message) {
    super(KeraiErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(KeraiErrorCode.IO_ERROR, message, cause);
  }
}
