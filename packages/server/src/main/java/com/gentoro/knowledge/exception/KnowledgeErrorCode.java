package com.gentoro.knowledge.exception;

/**
 * Canonical error codes. Codes are stable and suitable for downstream services and logs; each one
 * carries the {@link ErrorKind} used when an exception does not override it.
 */
public enum KnowledgeErrorCode {
  // Generic
  UNKNOWN(ErrorKind.RUNTIME),
  INVALID_ARGUMENT(ErrorKind.NORMAL),
  NOT_FOUND(ErrorKind.NORMAL),
  UNAVAILABLE(ErrorKind.NORMAL),
  PERMISSION_DENIED(ErrorKind.NORMAL),
  RESOURCE_EXHAUSTED(ErrorKind.RETRYABLE),
  CANCELLED(ErrorKind.ACTION),
  FAILED_PRECONDITION(ErrorKind.RUNTIME),

  // I/O and configuration
  CONFIGURATION_ERROR(ErrorKind.RUNTIME),
  IO_ERROR(ErrorKind.RUNTIME),
  SERIALIZATION_ERROR(ErrorKind.RUNTIME),
  NETWORK_ERROR(ErrorKind.RETRYABLE),

  // Domain specific
  URI_FORMAT_ERROR(ErrorKind.NORMAL),
  STORAGE_ERROR(ErrorKind.RUNTIME),
  INGESTION_ERROR(ErrorKind.RUNTIME),
  CONNECTOR_ERROR(ErrorKind.RUNTIME);

  private final ErrorKind defaultKind;

  KnowledgeErrorCode(ErrorKind defaultKind) {
    this.defaultKind = defaultKind;
  }

  public ErrorKind defaultKind() {
    return defaultKind;
  }
}
