package com.gentoro.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.http.OkHttpFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Settings and configuration loading")
class KnowledgeSettingsTest {

  @TempDir Path tempDir;

  private Configuration configuration;

  @BeforeEach
  void setUp() {
    configuration = new BaseConfiguration();
  }

  private static KnowledgeSettings.ConnectorSettings connector(
      KnowledgeSettings settings, String realm) {
    return settings.connectors().stream()
        .filter(c -> c.realm().equals(realm))
        .findFirst()
        .orElseThrow();
  }

  @Test
  @DisplayName("An empty configuration yields the defaults")
  void defaults() {
    KnowledgeSettings settings = KnowledgeSettings.from(configuration);

    assertEquals("memory", settings.storageType());
    assertEquals("", settings.storagePrefix());
    assertEquals(KnowledgeSettings.DEFAULT_CHUNK_TOKENS, settings.chunkingThresholdTokens());
    assertEquals(KnowledgeSettings.DEFAULT_CHUNK_TOKENS, settings.maxChunkTokens());
    assertEquals(KnowledgeSettings.DEFAULT_CONCURRENCY, settings.defaultConcurrency());
    assertEquals(120L, settings.queryTimeoutSeconds());
    assertEquals(List.of(), settings.connectors());
  }

  @Test
  @DisplayName("Connector blocks are grouped by realm")
  void readsConnectors() {
    configuration.setProperty("storage.prefix", "v1");
    configuration.setProperty("ingestion.chunking-threshold-tokens", 100);
    configuration.setProperty("connectors.jira.type", "jira");
    configuration.setProperty("connectors.jira.domain", "example.atlassian.net");
    configuration.setProperty("connectors.jira.max-concurrency", 2);
    configuration.setProperty("connectors.docs.type", "files");
    configuration.setProperty("connectors.docs.root", "/srv/docs");

    KnowledgeSettings settings = KnowledgeSettings.from(configuration);

    assertEquals("v1", settings.storagePrefix());
    assertEquals(100, settings.chunkingThresholdTokens());
    assertEquals(2, settings.connectors().size());
    KnowledgeSettings.ConnectorSettings jira = connector(settings, "jira");
    assertEquals("jira", jira.type());
    assertEquals("example.atlassian.net", jira.require("domain"));
    assertEquals(2, jira.getInt("max-concurrency", 4));
    assertEquals("JIRA_USERNAME", jira.get("username-var", "JIRA_USERNAME"));
    assertEquals("/srv/docs", connector(settings, "docs").require("root"));
  }

  @Test
  @DisplayName("Invalid values are configuration errors")
  void rejectsInvalidValues() {
    configuration.setProperty("ingestion.max-chunk-tokens", -5);
    assertThrows(ConfigException.class, () -> KnowledgeSettings.from(configuration));

    Configuration missingType = new BaseConfiguration();
    missingType.setProperty("connectors.jira.domain", "example.atlassian.net");
    assertThrows(ConfigException.class, () -> KnowledgeSettings.from(missingType));

    Configuration notANumber = new BaseConfiguration();
    notANumber.setProperty("connectors.jira.type", "jira");
    notANumber.setProperty("connectors.jira.max-concurrency", "many");
    KnowledgeSettings.ConnectorSettings jira = connector(KnowledgeSettings.from(notANumber), "jira");
    assertThrows(ConfigException.class, () -> jira.getInt("max-concurrency", 4));
    assertThrows(ConfigException.class, () -> jira.require("domain"));
  }

  @Test
  @DisplayName("Connectors are built from their settings blocks")
  void buildsRegistry() {
    configuration.setProperty("connectors.jira.type", "jira");
    configuration.setProperty("connectors.jira.domain", "example.atlassian.net");
    configuration.setProperty("connectors.docs.type", "files");
    configuration.setProperty("connectors.docs.volume", "handbook");
    configuration.setProperty("connectors.docs.root", tempDir.toString());

    ConnectorRegistry registry =
        KnowledgeServer.buildRegistry(KnowledgeSettings.from(configuration), OkHttpFactory.create());

    assertEquals(
        List.of("docs", "jira"),
        registry.connectors().stream().map(Connector::realm).sorted().toList());
  }

  @Test
  @DisplayName("Unknown connector types are refused")
  void refusesUnknownConnector() {
    configuration.setProperty("connectors.wiki.type", "confluence");

    KnowledgeSettings settings = KnowledgeSettings.from(configuration);

    assertThrows(
        ConfigException.class, () -> KnowledgeServer.buildRegistry(settings, OkHttpFactory.create()));
  }

  @Test
  @DisplayName("YAML files are loaded from a path")
  void loadsYamlFile() throws Exception {
    Path file = tempDir.resolve("knowledge.yaml");
    Files.writeString(
        file,
        """
        storage:
          type: local
          root-dir: /var/lib/knowledge
        query:
          timeout-seconds: 30
        connectors:
          jira:
            type: jira
            domain: example.atlassian.net
        """);

    KnowledgeSettings settings =
        KnowledgeSettings.from(new ConfigurationProvider(file.toString()).config());

    assertEquals("local", settings.storageType());
    assertEquals("/var/lib/knowledge", settings.storageRootDir());
    assertEquals(30L, settings.queryTimeoutSeconds());
    assertEquals("example.atlassian.net", connector(settings, "jira").require("domain"));
  }

  @Test
  @DisplayName("A missing configuration file is reported")
  void missingFile() {
    String location = tempDir.resolve("absent.yaml").toString();

    assertThrows(ConfigException.class, () -> new ConfigurationProvider(location));
  }
}
