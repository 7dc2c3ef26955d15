package com.gentoro.knowledge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Base runtime exception carrying a stable {@link KnowledgeErrorCode}, an {@link ErrorKind}, an
 * error id for cross-log correlation and optional context.
 *
 * <p>The context map is defensively copied and unmodifiable. When the cause is itself a {@code
 * KnowledgeException}, its error id is reused so re-wrapped errors keep their identity.
 */
public class KnowledgeException extends RuntimeException {
  private final KnowledgeErrorCode code;
  private final ErrorKind kind;
  private final String errorId;
  private final Map<String, Object> context;

  public KnowledgeException(KnowledgeErrorCode code, String message) {
    this(code, null, message, null, null, null);
  }

  public KnowledgeException(KnowledgeErrorCode code, String message, Throwable cause) {
    this(code, null, message, null, cause, null);
  }

  public KnowledgeException(KnowledgeErrorCode code, String message, Map<String, ?> context) {
    this(code, null, message, context, null, null);
  }

  public KnowledgeException(
      KnowledgeErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    this(code, null, message, context, cause, null);
  }

  protected KnowledgeException(
      KnowledgeErrorCode code,
      ErrorKind kind,
      String message,
      Map<String, ?> context,
      Throwable cause,
      String errorId) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.kind = kind == null ? code.defaultKind() : kind;
    this.context = copy(context);
    this.errorId = errorId != null ? errorId : inheritedErrorId(cause);
  }

  public KnowledgeErrorCode getCode() {
    return code;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Unique id of this error occurrence, included in logs and responses. */
  public String getErrorId() {
    return errorId;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static String inheritedErrorId(Throwable cause) {
    if (cause instanceof KnowledgeException ke) {
      return ke.getErrorId();
    }
    return UUID.randomUUID().toString();
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach((k, v) -> m.put(k, v));
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", kind="
        + kind
        + ", errorId="
        + errorId
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
