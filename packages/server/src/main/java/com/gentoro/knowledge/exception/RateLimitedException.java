package com.gentoro.knowledge.exception;

/** Upstream service throttled the request; the caller may retry with backoff. */
public class RateLimitedException extends KnowledgeException {
  public RateLimitedException(String message) {
    super(KnowledgeErrorCode.RESOURCE_EXHAUSTED, message);
  }

  public RateLimitedException(String message, Throwable cause) {
    super(KnowledgeErrorCode.RESOURCE_EXHAUSTED, message, cause);
  }
}
