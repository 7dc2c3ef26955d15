package com.gentoro.knowledge.connector.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.knowledge.exception.ForbiddenException;
import com.gentoro.knowledge.exception.KnowledgeException;
import com.gentoro.knowledge.exception.NetworkException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.RateLimitedException;
import com.gentoro.knowledge.exception.SerializationException;
import com.gentoro.knowledge.exception.UnavailableException;
import com.gentoro.knowledge.utility.JacksonUtility;
import java.io.IOException;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Thin JSON client over the Jira REST API. */
class JiraClient {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(JiraClient.class);

  private final String domain;
  private final OkHttpClient http;

  JiraClient(String domain, OkHttpClient http) {
    this.domain = domain;
    this.http = http;
  }

  /**
   * GETs {@code https://{domain}/{path}} and parses the JSON response. HTTP failures are mapped to
   * the exception kinds callers act upon: 404 is terminal, 401/403 means missing permissions, 429
   * and 5xx are retryable.
   */
  JsonNode get(String path, Map<String, String> query, String authorization) {
    HttpUrl.Builder url =
        new HttpUrl.Builder().scheme("https").host(domain).addPathSegments(path);
    query.forEach(url::addQueryParameter);
    Request request =
        new Request.Builder()
            .url(url.build())
            .header("Accept", "application/json")
            .header("Authorization", authorization)
            .get()
            .build();

    long start = System.currentTimeMillis();
    try (Response response = http.newCall(request).execute()) {
      log.trace(
          "Jira {} answered {} in ({}ms)",
          path,
          response.code(),
          System.currentTimeMillis() - start);
      if (!response.isSuccessful()) {
        throw failure(response.code(), path);
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new UnavailableException("Jira returned an empty body for " + path);
      }
      return JacksonUtility.getJsonMapper().readTree(body.string());
    } catch (KnowledgeException e) {
      throw e;
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      throw new SerializationException("Jira returned invalid JSON for " + path, e);
    } catch (IOException e) {
      throw new NetworkException("Request to Jira could not be executed: " + path, e);
    }
  }

  static KnowledgeException failure(int status, String path) {
    String message = "Jira request %s failed with status %d".formatted(path, status);
    if (status == 404) return new NotFoundException(message);
    if (status == 401 || status == 403) return new ForbiddenException(message);
    if (status == 429) return new RateLimitedException(message);
    if (status >= 500) return new NetworkException(message);
    return new UnavailableException(message, Map.of("status", status));
  }
}
