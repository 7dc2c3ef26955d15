package com.gentoro.knowledge.exception;

/** The request was cancelled by its caller; never retried. */
public class CancelledException extends KnowledgeException {
  public CancelledException(String message) {
    super(KnowledgeErrorCode.CANCELLED, message);
  }

  public CancelledException(String message, Throwable cause) {
    super(KnowledgeErrorCode.CANCELLED, message, cause);
  }
}
