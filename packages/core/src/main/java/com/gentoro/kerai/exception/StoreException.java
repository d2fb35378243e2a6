package com.gentoro.kerai.exception;

/** The backing graph store is unavailable or rejected a read or append. */
public class StoreException extends KeraiException {
  public StoreException(String message) {
    super(KeraiErrorCode.STORE_UNAVAILABLE, message);
  }

  public StoreException(String message, Throwable cause) {
    super(KeraiErrorCode.STORE_UNAVAILABLE, message, cause);
  }
}
