package com.gentoro.knowledge.exception;

import java.util.Map;

/**
 * Object storage failure. Failures the backend reports as transient are {@link
 * ErrorKind#RETRYABLE}, anything else is {@link ErrorKind#RUNTIME}.
 */
public class StorageException extends KnowledgeException {
  private StorageException(ErrorKind kind, String message, String key, Throwable cause) {
    super(KnowledgeErrorCode.STORAGE_ERROR, kind, message, Map.of("key", key), cause, null);
  }

  public static StorageException transientFailure(String message, String key, Throwable cause) {
    return new StorageException(ErrorKind.RETRYABLE, message, key, cause);
  }

  public static StorageException permanentFailure(String message, String key, Throwable cause) {
    return new StorageException(ErrorKind.RUNTIME, message, key, cause);
  }

  public boolean isTransient() {
    return getKind() == ErrorKind.RETRYABLE;
  }
}
