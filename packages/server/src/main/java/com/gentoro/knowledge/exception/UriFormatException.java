package com.gentoro.knowledge.exception;

import java.util.Map;

/** A string could not be parsed as a knowledge or external URI. */
public class UriFormatException extends KnowledgeException {
  public UriFormatException(String message, String value) {
    super(KnowledgeErrorCode.URI_FORMAT_ERROR, message, Map.of("value", String.valueOf(value)));
  }
}
