package com.gentoro.specops.exception;

/**
 * Canonical error codes for the content analyzer. Codes are stable and suitable for downstream
 * tooling and logs. Prefer the most specific code that reflects the failure origin.
 */
public enum SpecOpsErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
}
