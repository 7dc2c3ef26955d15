package com.gentoro.knowledge.exception;

/** Transient network failure while talking to an upstream system. */
public class NetworkException extends KnowledgeException {
  public NetworkException(String message) {
    super(KnowledgeErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(KnowledgeErrorCode.NETWORK_ERROR, message, cause);
  }
}
