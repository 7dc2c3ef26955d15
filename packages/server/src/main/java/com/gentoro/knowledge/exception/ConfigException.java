package com.gentoro.knowledge.exception;

/** Invalid or missing configuration. */
public class ConfigException extends KnowledgeException {
  public ConfigException(String message) {
    super(KnowledgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KnowledgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
