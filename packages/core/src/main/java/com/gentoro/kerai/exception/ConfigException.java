package com.gentoro.kerai.exception;

/** Configuration is missing or invalid. */
public class ConfigException extends KeraiException {
  public ConfigException(String message) {
    super(KeraiErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KeraiErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
