package com.gentoro.knowledge.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExceptionUtil error details")
class ExceptionUtilTest {

  @Test
  @DisplayName("Expected errors carry no diagnostics")
  void normalErrorsAreRedacted() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new UriFormatException("Bad URI", "ndk://x"));

    assertEquals(ErrorKind.NORMAL, details.kind);
    assertEquals(KnowledgeErrorCode.URI_FORMAT_ERROR, details.code);
    assertEquals("UriFormatException", details.type);
    assertEquals("Bad URI", details.message);
    assertNull(details.context);
    assertNull(details.stacktrace);
    assertNotNull(details.errorId);
  }

  @Test
  @DisplayName("Runtime faults expose context and a compact stack trace")
  void runtimeErrorsIncludeDiagnostics() {
    KnowledgeException fault =
        new KnowledgeException(
            KnowledgeErrorCode.STORAGE_ERROR, "Disk full", Map.of("key", "v1/resource/a.yml"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(fault);

    assertEquals(ErrorKind.RUNTIME, details.kind);
    assertEquals("v1/resource/a.yml", details.context.get("key"));
    assertNotNull(details.stacktrace);
    assertTrue(details.stacktrace.contains("ExceptionUtilTest"), details.stacktrace);
  }

  @Test
  @DisplayName("Foreign exceptions become unknown runtime faults named after their origin")
  void foreignExceptions() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException("boom"));

    assertEquals(KnowledgeErrorCode.UNKNOWN, details.code);
    assertEquals(ErrorKind.RUNTIME, details.kind);
    assertEquals("IllegalStateException", details.type);
    assertEquals("Internal error: boom", details.message);
  }

  @Test
  @DisplayName("Executor wrappers are unwrapped to the original exception")
  void unwrapsExecutorExceptions() {
    ForbiddenException forbidden = new ForbiddenException("No access");

    assertSame(
        forbidden, ExceptionUtil.toKnowledgeException(new ExecutionException(forbidden)));
    assertSame(
        forbidden,
        ExceptionUtil.toKnowledgeException(
            new CompletionException(new ExecutionException(forbidden))));
    assertInstanceOf(
        CancelledException.class, ExceptionUtil.toKnowledgeException(new CancellationException()));
  }

  @Test
  @DisplayName("Compact stack traces are limited to the requested frames")
  void compactStackTrace() {
    Exception e = new Exception("x");

    String two = ExceptionUtil.formatCompactStackTrace(e, 2);

    assertEquals(1, two.split(" > ").length - 1, two);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null, 2));
  }
}
