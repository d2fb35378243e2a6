package com.gentoro.kerai.exception;

/**
 * Canonical error codes for Kerai. Codes are stable and safe to surface to callers of the ingest
 * and reconstruction entry points, and to logs.
 */
public enum KeraiErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PARSE_ERROR,
  STORE_UNAVAILABLE,
  SIGNATURE_ERROR,
  // Reserved: normalization is a total function and never fails.
  NORMALIZATION_ERROR,
}
