package com.gentoro.knowledge.exception;

/** Access to an upstream resource was denied. */
public class ForbiddenException extends KnowledgeException {
  public ForbiddenException(String message) {
    super(KnowledgeErrorCode.PERMISSION_DENIED, message);
  }

  public ForbiddenException(String message, Throwable cause) {
    super(KnowledgeErrorCode.PERMISSION_DENIED, message, cause);
  }
}
