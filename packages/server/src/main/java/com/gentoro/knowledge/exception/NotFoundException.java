package com.gentoro.knowledge.exception;

/** Resource requested was not found. */
public class NotFoundException extends KnowledgeException {
  public NotFoundException(String message) {
    super(KnowledgeErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(KnowledgeErrorCode.NOT_FOUND, message, cause);
  }
}
