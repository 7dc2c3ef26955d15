package com.gentoro.knowledge.exception;

/** Input rejected because it does not satisfy a precondition. */
public class ValidationException extends KnowledgeException {
  public ValidationException(String message) {
    super(KnowledgeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(KnowledgeErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
