package com.gentoro.knowledge.exception;

import java.util.Map;

/**
 * The target is either missing or not visible with the available credentials. Connectors use it
 * when they cannot tell the two apart without leaking information.
 */
public class UnavailableException extends KnowledgeException {
  public UnavailableException(String message) {
    super(KnowledgeErrorCode.UNAVAILABLE, message);
  }

  public UnavailableException(String message, Map<String, ?> context) {
    super(KnowledgeErrorCode.UNAVAILABLE, message, context);
  }
}
