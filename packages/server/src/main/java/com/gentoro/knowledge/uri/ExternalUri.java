package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.UriFormatException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * An absolute URL outside the knowledge namespace, normalized so that equivalent spellings map to
 * the same alias: lower-case scheme and host, no fragment, no trailing slash.
 */
public final class ExternalUri implements Reference, Comparable<ExternalUri> {
  private final String scheme;
  private final String host;
  private final String path;
  private final String query;
  private final String normalized;

  private ExternalUri(String scheme, String host, int port, String path, String query) {
    this.scheme = scheme;
    this.host = host;
    this.path = path;
    this.query = query;
    StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
    if (port >= 0) sb.append(':').append(port);
    sb.append(path);
    if (query != null) sb.append('?').append(query);
    this.normalized = sb.toString();
  }

  @JsonCreator
  public static ExternalUri parse(String value) {
    if (value == null || value.isBlank()) {
      throw new UriFormatException("Empty URL", value);
    }
    URI uri;
    try {
      uri = new URI(value.trim());
    } catch (URISyntaxException e) {
      throw new UriFormatException("Malformed URL: " + e.getReason(), value);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new UriFormatException("URL must be absolute with a host", value);
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    if (scheme.equals("ndk")) {
      throw new UriFormatException("Knowledge URIs are not external URLs", value);
    }
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return new ExternalUri(
        scheme, uri.getHost().toLowerCase(Locale.ROOT), uri.getPort(), path, uri.getRawQuery());
  }

  public String scheme() {
    return scheme;
  }

  public String host() {
    return host;
  }

  /** Raw path without trailing slash; empty for the root. */
  public String path() {
    return path;
  }

  public String query() {
    return query;
  }

  /** Decoded value of a query parameter, or {@code null} when absent. */
  public String queryParameter(String name) {
    if (query == null) return null;
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
        return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  @JsonValue
  @Override
  public String toString() {
    return normalized;
  }

  @Override
  public int compareTo(ExternalUri o) {
    return normalized.compareTo(o.normalized);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof ExternalUri other && normalized.equals(other.normalized);
  }

  @Override
  public int hashCode() {
    return normalized.hashCode();
  }
}
