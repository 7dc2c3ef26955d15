package com.gentoro.knowledge.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/**
 * Lightweight DTO exposing structured error information to logs or responses. {@code context} and
 * {@code stacktrace} are only populated for {@link ErrorKind#RUNTIME} errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorDetails {
  public final String errorId;
  public final ErrorKind kind;
  public final KnowledgeErrorCode code;
  public final String type;
  public final String message;
  public final Map<String, Object> context;
  public final String stacktrace;
  public final Instant timestamp;

  public ErrorDetails(
      String errorId,
      ErrorKind kind,
      KnowledgeErrorCode code,
      String type,
      String message,
      Map<String, Object> context,
      String stacktrace,
      Instant timestamp) {
    this.errorId = errorId;
    this.kind = kind;
    this.code = code;
    this.type = type;
    this.message = message;
    this.context = context;
    this.stacktrace = stacktrace;
    this.timestamp = timestamp;
  }
}
