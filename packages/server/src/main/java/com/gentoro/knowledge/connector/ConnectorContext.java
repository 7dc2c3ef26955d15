package com.gentoro.knowledge.connector;

import com.gentoro.knowledge.exception.CancelledException;
import com.gentoro.knowledge.exception.ExceptionUtil;
import com.gentoro.knowledge.exception.UnavailableException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Request-scoped state handed to every connector call: caller credentials, memoized sub-fetches
 * and cancellation. A context is never shared between requests.
 */
public class ConnectorContext {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(ConnectorContext.class);

  /** Value of the {@code Authorization} header; {@code isPublic} when it came from the server. */
  public record Authorization(String header, boolean isPublic) {}

  private final Map<String, String> credentials;
  private final Function<String, String> environment;
  private final Map<String, CompletableFuture<Object>> memo = new ConcurrentHashMap<>();
  private volatile boolean cancelled;

  /**
   * @param credentials per-realm {@code Authorization} header values supplied with the request
   * @param environment lookup for server-side secrets, keyed by variable name
   */
  public ConnectorContext(Map<String, String> credentials, Function<String, String> environment) {
    this.credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    this.environment = environment == null ? name -> null : environment;
  }

  public static ConnectorContext anonymous() {
    return new ConnectorContext(Map.of(), System::getenv);
  }

  public Authorization basicAuthorization(
      String realm, String publicUsernameVar, String publicPasswordVar) {
    String header = credentials.get(realm);
    if (header != null) {
      return new Authorization(header, false);
    }
    String username = lookup(publicUsernameVar);
    String password = lookup(publicPasswordVar);
    if (username != null && password != null) {
      String token =
          Base64.getEncoder()
              .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
      return new Authorization("Basic " + token, true);
    }
    throw new UnavailableException(
        "No credentials available for realm '%s'".formatted(realm), Map.of("realm", realm));
  }

  public Authorization bearerAuthorization(String realm, String publicTokenVar) {
    String header = credentials.get(realm);
    if (header != null) {
      return new Authorization(header, false);
    }
    String token = lookup(publicTokenVar);
    if (token != null) {
      return new Authorization("Bearer " + token, true);
    }
    throw new UnavailableException(
        "No credentials available for realm '%s'".formatted(realm), Map.of("realm", realm));
  }

  /**
   * Runs {@code loader} at most once per key within this request. Failures are memoized too and
   * rethrown to every caller.
   */
  @SuppressWarnings("unchecked")
  public <T> T memoize(String key, Supplier<T> loader) {
    ensureActive();
    CompletableFuture<Object> created = new CompletableFuture<>();
    CompletableFuture<Object> existing = memo.putIfAbsent(key, created);
    if (existing == null) {
      try {
        created.complete(loader.get());
      } catch (RuntimeException e) {
        created.completeExceptionally(e);
      }
      existing = created;
    } else {
      log.trace("Memoized value reused for {}", key);
    }
    try {
      return (T) existing.join();
    } catch (CompletionException e) {
      throw ExceptionUtil.toKnowledgeException(e);
    }
  }

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Throws {@link CancelledException} once the request was cancelled or its thread interrupted. */
  public void ensureActive() {
    if (cancelled || Thread.currentThread().isInterrupted()) {
      throw new CancelledException("The request was cancelled");
    }
  }

  private String lookup(String variable) {
    if (variable == null || variable.isBlank()) {
      return null;
    }
    String value = environment.apply(variable);
    return value == null || value.isBlank() ? null : value;
  }
}
