package com.gentoro.linktree.exception;

/**
 * Canonical error codes for the link tree engine. Codes are stable and suitable for downstream
 * callers and logs. Prefer the most specific code that reflects the failure origin.
 */
public enum LinkTreeErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
}
