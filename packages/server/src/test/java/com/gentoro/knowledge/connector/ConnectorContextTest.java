package com.gentoro.knowledge.connector;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.exception.CancelledException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.UnavailableException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConnectorContext")
class ConnectorContextTest {

  private static final Map<String, String> ENV = Map.of("USER_VAR", "bot", "TOKEN_VAR", "t0k3n");

  @Test
  @DisplayName("Request credentials take precedence over server variables")
  void requestCredentialsFirst() {
    ConnectorContext context = new ConnectorContext(Map.of("jira", "Basic abc"), ENV::get);

    ConnectorContext.Authorization auth = context.basicAuthorization("jira", "USER_VAR", "TOKEN_VAR");

    assertEquals("Basic abc", auth.header());
    assertFalse(auth.isPublic());
  }

  @Test
  @DisplayName("Server variables are used as a public account when the request has none")
  void serverAccountFallback() {
    ConnectorContext context = new ConnectorContext(Map.of(), ENV::get);

    assertEquals("Basic Ym90OnQwazNu", context.basicAuthorization("jira", "USER_VAR", "TOKEN_VAR").header());
    ConnectorContext.Authorization bearer = context.bearerAuthorization("other", "TOKEN_VAR");
    assertEquals("Bearer t0k3n", bearer.header());
    assertTrue(bearer.isPublic());
  }

  @Test
  @DisplayName("Without any credentials the realm is unavailable")
  void noCredentials() {
    ConnectorContext context = new ConnectorContext(null, name -> "  ");

    assertThrows(
        UnavailableException.class, () -> context.basicAuthorization("jira", "USER_VAR", "TOKEN_VAR"));
    assertThrows(UnavailableException.class, () -> context.bearerAuthorization("jira", null));
  }

  @Test
  @DisplayName("Memoized loaders run once per key, failures included")
  void memoizes() {
    ConnectorContext context = new ConnectorContext(Map.of(), ENV::get);
    AtomicInteger calls = new AtomicInteger();

    assertEquals("v", context.memoize("k", () -> { calls.incrementAndGet(); return "v"; }));
    assertEquals("v", context.memoize("k", () -> { calls.incrementAndGet(); return "w"; }));
    assertEquals(1, calls.get());

    assertThrows(
        NotFoundException.class,
        () -> context.memoize("bad", () -> { calls.incrementAndGet(); throw new NotFoundException("x"); }));
    assertThrows(NotFoundException.class, () -> context.memoize("bad", () -> "never"));
    assertEquals(2, calls.get());
  }

  @Test
  @DisplayName("A cancelled context refuses further work")
  void cancellation() {
    ConnectorContext context = new ConnectorContext(Map.of(), ENV::get);
    context.cancel();

    assertTrue(context.isCancelled());
    assertThrows(CancelledException.class, context::ensureActive);
    assertThrows(CancelledException.class, () -> context.memoize("k", () -> "v"));
  }
}
