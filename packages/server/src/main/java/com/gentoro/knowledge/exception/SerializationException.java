package com.gentoro.knowledge.exception;

/** Failure to read or write a serialized representation. */
public class SerializationException extends KnowledgeException {
  public SerializationException(String message) {
    super(KnowledgeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KnowledgeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
