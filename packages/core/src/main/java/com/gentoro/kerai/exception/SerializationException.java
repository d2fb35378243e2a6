package com.gentoro.kerai.exception;

/** Failed to serialize or deserialize data (JSON/YAML). */
public class SerializationException extends KeraiException {
  public SerializationException(String message) {
    super(KeraiErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KeraiErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
