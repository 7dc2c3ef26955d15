package com.gentoro.knowledge;

import com.gentoro.knowledge.exception.ConfigException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view of the application configuration.
 *
 * <pre>
 * storage:
 *   type: local            # memory | local
 *   root-dir: ./data
 *   prefix: v1
 * ingestion:
 *   chunking-threshold-tokens: 4000
 *   max-chunk-tokens: 4000
 * connectors:
 *   jira:
 *     type: jira
 *     domain: example.atlassian.net
 * </pre>
 */
public record KnowledgeSettings(
    String storageType,
    String storageRootDir,
    String storagePrefix,
    int chunkingThresholdTokens,
    int maxChunkTokens,
    int fragmentThresholdTokens,
    int fragmentTrimmedTokens,
    int defaultConcurrency,
    long queryTimeoutSeconds,
    List<ConnectorSettings> connectors) {

  public static final int DEFAULT_CHUNK_TOKENS = 4000;
  public static final int DEFAULT_FRAGMENT_THRESHOLD_TOKENS = 800_000;
  public static final int DEFAULT_FRAGMENT_TRIMMED_TOKENS = 600_000;
  public static final int DEFAULT_CONCURRENCY = 4;

  public KnowledgeSettings {
    connectors = connectors == null ? List.of() : List.copyOf(connectors);
  }

  /** Settings of one {@code connectors.<realm>} block. */
  public record ConnectorSettings(String realm, String type, Map<String, String> properties) {
    public ConnectorSettings {
      properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public String get(String key, String defaultValue) {
      String value = properties.get(key);
      return value == null || value.isBlank() ? defaultValue : value;
    }

    public String require(String key) {
      String value = get(key, null);
      if (value == null) {
        throw new ConfigException(
            "Missing 'connectors.%s.%s' in the configuration".formatted(realm, key));
      }
      return value;
    }

    public int getInt(String key, int defaultValue) {
      String value = get(key, null);
      if (value == null) return defaultValue;
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new ConfigException(
            "'connectors.%s.%s' must be a number: %s".formatted(realm, key, value), e);
      }
    }
  }

  public static KnowledgeSettings from(Configuration cfg) {
    return new KnowledgeSettings(
        cfg.getString("storage.type", "memory"),
        cfg.getString("storage.root-dir", "data"),
        cfg.getString("storage.prefix", ""),
        positive(cfg, "ingestion.chunking-threshold-tokens", DEFAULT_CHUNK_TOKENS),
        positive(cfg, "ingestion.max-chunk-tokens", DEFAULT_CHUNK_TOKENS),
        positive(cfg, "ingestion.fragment-threshold-tokens", DEFAULT_FRAGMENT_THRESHOLD_TOKENS),
        positive(cfg, "ingestion.fragment-trimmed-tokens", DEFAULT_FRAGMENT_TRIMMED_TOKENS),
        positive(cfg, "query.default-concurrency", DEFAULT_CONCURRENCY),
        cfg.getLong("query.timeout-seconds", 120L),
        connectors(cfg));
  }

  private static List<ConnectorSettings> connectors(Configuration cfg) {
    Map<String, Map<String, String>> byRealm = new LinkedHashMap<>();
    Configuration subset = cfg.subset("connectors");
    Iterator<String> keys = subset.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      int dot = key.indexOf('.');
      if (dot <= 0) continue;
      String realm = key.substring(0, dot);
      byRealm
          .computeIfAbsent(realm, r -> new LinkedHashMap<>())
          .put(key.substring(dot + 1), subset.getString(key));
    }
    List<ConnectorSettings> result = new ArrayList<>();
    for (Map.Entry<String, Map<String, String>> entry : byRealm.entrySet()) {
      String type = entry.getValue().get("type");
      if (type == null || type.isBlank()) {
        throw new ConfigException(
            "Missing 'connectors.%s.type' in the configuration".formatted(entry.getKey()));
      }
      result.add(new ConnectorSettings(entry.getKey(), type.trim(), entry.getValue()));
    }
    return result;
  }

  private static int positive(Configuration cfg, String key, int defaultValue) {
    int value;
    try {
      value = cfg.getInt(key, defaultValue);
    } catch (RuntimeException e) {
      throw new ConfigException("'%s' must be a number".formatted(key), e);
    }
    if (value <= 0) {
      throw new ConfigException("'%s' must be positive, got %d".formatted(key, value));
    }
    return value;
  }
}
