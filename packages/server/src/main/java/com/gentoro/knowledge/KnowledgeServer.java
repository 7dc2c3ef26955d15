package com.gentoro.knowledge;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.connector.files.LocalFilesConnector;
import com.gentoro.knowledge.connector.jira.JiraConnector;
import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.http.OkHttpFactory;
import com.gentoro.knowledge.ingestion.EstimatingTokenizer;
import com.gentoro.knowledge.ingestion.IngestionPipeline;
import com.gentoro.knowledge.ingestion.MarkdownChunker;
import com.gentoro.knowledge.ingestion.Tokenizer;
import com.gentoro.knowledge.query.QueryService;
import com.gentoro.knowledge.resolve.CachePolicy;
import com.gentoro.knowledge.resolve.LocatorResolver;
import com.gentoro.knowledge.resolve.ResolutionEngine;
import com.gentoro.knowledge.storage.BundleStore;
import com.gentoro.knowledge.storage.ObjectStorage;
import com.gentoro.knowledge.storage.ObjectStorageFactory;
import com.gentoro.knowledge.storage.StorageKeys;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.function.Function;
import okhttp3.OkHttpClient;

/** Wires the connectors, the store, the ingestion pipeline and the query service together. */
public class KnowledgeServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(KnowledgeServer.class);

  private final KnowledgeSettings settings;
  private final ConnectorRegistry registry;
  private final BundleStore store;
  private final LocatorResolver locators;
  private final ResolutionEngine engine;
  private final QueryService queryService;

  /** Production wiring; {@code environment} resolves connector credential variables. */
  public KnowledgeServer(KnowledgeSettings settings, Function<String, String> environment) {
    this(
        settings,
        buildRegistry(settings, OkHttpFactory.create()),
        ObjectStorageFactory.create(settings.storageType(), settings.storageRootDir()),
        environment,
        Clock.systemUTC());
  }

  public KnowledgeServer(
      KnowledgeSettings settings,
      ConnectorRegistry registry,
      ObjectStorage storage,
      Function<String, String> environment,
      Clock clock) {
    this.settings = settings;
    this.registry = registry;
    this.store =
        new BundleStore(storage, new StorageKeys(settings.storagePrefix()), registry.locatorTypes());
    this.locators = new LocatorResolver(registry, store);

    Tokenizer tokenizer = new EstimatingTokenizer();
    MarkdownChunker chunker =
        new MarkdownChunker(
            tokenizer, settings.chunkingThresholdTokens(), settings.maxChunkTokens());
    IngestionPipeline pipeline =
        new IngestionPipeline(
            tokenizer,
            chunker,
            locators,
            settings.fragmentThresholdTokens(),
            settings.fragmentTrimmedTokens());
    this.engine = new ResolutionEngine(registry, store, pipeline, new CachePolicy(), clock);
    this.queryService =
        new QueryService(
            registry, locators, engine, store, environment, settings.queryTimeoutSeconds());
    log.info(
        "Knowledge server ready with realms {}",
        registry.connectors().stream().map(Connector::realm).toList());
  }

  /** Builds one connector per {@code connectors.<realm>} block, in configuration order. */
  static ConnectorRegistry buildRegistry(KnowledgeSettings settings, OkHttpClient http) {
    ConnectorRegistry.Builder builder = ConnectorRegistry.builder();
    for (KnowledgeSettings.ConnectorSettings connector : settings.connectors()) {
      builder.register(createConnector(settings, connector, http));
    }
    return builder.build();
  }

  private static Connector createConnector(
      KnowledgeSettings settings, KnowledgeSettings.ConnectorSettings cs, OkHttpClient http) {
    return switch (cs.type().toLowerCase(Locale.ROOT)) {
      case "jira" -> new JiraConnector(
          cs.realm(),
          cs.require("domain"),
          cs.get("username-var", "JIRA_USERNAME"),
          cs.get("token-var", "JIRA_API_TOKEN"),
          cs.getInt("max-concurrency", settings.defaultConcurrency()),
          http);
      case "files" -> new LocalFilesConnector(
          cs.realm(), cs.get("volume", "local"), Path.of(cs.require("root")));
      default -> throw new ConfigException(
          "Unknown connector type '%s' for realm '%s'".formatted(cs.type(), cs.realm()));
    };
  }

  public KnowledgeSettings settings() {
    return settings;
  }

  public ConnectorRegistry registry() {
    return registry;
  }

  public BundleStore store() {
    return store;
  }

  public LocatorResolver locators() {
    return locators;
  }

  public ResolutionEngine engine() {
    return engine;
  }

  public QueryService queryService() {
    return queryService;
  }

  @Override
  public void close() {
    queryService.close();
  }
}
