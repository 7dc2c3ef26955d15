package com.gentoro.knowledge.exception;

/** Component used in an invalid state. */
public class StateException extends KnowledgeException {
  public StateException(String message) {
    super(KnowledgeErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(KnowledgeErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
