package com.gentoro.knowledge.exception;

/** Failure while turning fetched content into a bundle. */
public class IngestionException extends KnowledgeException {
  public IngestionException(String message) {
    super(KnowledgeErrorCode.INGESTION_ERROR, message);
  }

  public IngestionException(String message, Throwable cause) {
    super(KnowledgeErrorCode.INGESTION_ERROR, message, cause);
  }
}
