package com.gentoro.knowledge.exception;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. Anything
   * that is not a {@link KnowledgeException} is reported as an unknown runtime fault.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    KnowledgeException ex = toKnowledgeException(t);
    boolean diagnostics = ex.getKind().includesDiagnostics();
    Throwable origin =
        ex.getCode() == KnowledgeErrorCode.UNKNOWN && ex.getCause() != null ? ex.getCause() : ex;
    return new ErrorDetails(
        ex.getErrorId(),
        ex.getKind(),
        ex.getCode(),
        origin.getClass().getSimpleName(),
        safeMessage(ex.getMessage()),
        diagnostics && !ex.getContext().isEmpty() ? ex.getContext() : null,
        diagnostics ? formatCompactStackTrace(origin) : null,
        Instant.now());
  }

  /**
   * Unwrap executor wrappers and map the throwable onto the exception hierarchy. Interruption and
   * future cancellation become {@link CancelledException}.
   */
  public static KnowledgeException toKnowledgeException(Throwable t) {
    Throwable cause = unwrap(t);
    if (cause instanceof KnowledgeException ke) {
      return ke;
    }
    if (cause instanceof CancellationException || cause instanceof InterruptedException) {
      return new CancelledException("Request was cancelled", cause);
    }
    return new KnowledgeException(
        KnowledgeErrorCode.UNKNOWN, "Internal error: " + safeMessage(cause.getMessage()), cause);
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining at most
   * {@code maxFrames} frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
