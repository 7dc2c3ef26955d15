package com.gentoro.knowledge;

import static com.gentoro.knowledge.connector.jira.JiraFixtures.DOMAIN;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.connector.jira.JiraConnector;
import com.gentoro.knowledge.connector.jira.JiraFixtures;
import com.gentoro.knowledge.connector.jira.JiraFixtures.Canned;
import com.gentoro.knowledge.model.BundleBody;
import com.gentoro.knowledge.query.QueryAction;
import com.gentoro.knowledge.query.QueryRequest;
import com.gentoro.knowledge.query.QueryResponse;
import com.gentoro.knowledge.resolve.LoadMode;
import com.gentoro.knowledge.storage.InMemoryObjectStorage;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Request;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KnowledgeServer end to end")
class KnowledgeServerTest {

  private static final Map<String, String> ENV =
      Map.of("JIRA_USERNAME", "bot@example.com", "JIRA_API_TOKEN", "secret");

  private Map<String, Canned> responses;
  private List<Request> seen;
  private InMemoryObjectStorage storage;
  private KnowledgeServer server;

  @BeforeEach
  void setUp() {
    responses = new HashMap<>();
    seen = new ArrayList<>();
    responses.put(
        "/rest/api/2/issue/ISSUE-1",
        Canned.ok(JiraFixtures.issueJson("ISSUE-1", "Login fails", "2024-01-03T03:04:05.000+0000")));
    KnowledgeSettings settings =
        new KnowledgeSettings(
            "memory",
            null,
            "v1",
            KnowledgeSettings.DEFAULT_CHUNK_TOKENS,
            KnowledgeSettings.DEFAULT_CHUNK_TOKENS,
            KnowledgeSettings.DEFAULT_FRAGMENT_THRESHOLD_TOKENS,
            KnowledgeSettings.DEFAULT_FRAGMENT_TRIMMED_TOKENS,
            KnowledgeSettings.DEFAULT_CONCURRENCY,
            30,
            List.of());
    ConnectorRegistry registry =
        ConnectorRegistry.builder()
            .register(
                new JiraConnector(
                    "jira",
                    DOMAIN,
                    "JIRA_USERNAME",
                    "JIRA_API_TOKEN",
                    4,
                    JiraFixtures.client(responses, seen)))
            .build();
    storage = new InMemoryObjectStorage();
    server =
        new KnowledgeServer(
            settings,
            registry,
            storage,
            ENV::get,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private QueryResponse load(LoadMode mode) {
    return server
        .queryService()
        .execute(QueryRequest.of(QueryAction.load("ndk://jira/ISSUE/ISSUE-1", mode)), Map.of());
  }

  @Test
  @DisplayName("A first load fetches the issue, stores it and returns its body")
  void firstLoadIsCached() {
    QueryResponse response = load(LoadMode.AUTO);

    assertEquals(List.of(), response.errors());
    assertEquals(1, response.resources().size());
    assertEquals(1, response.observations().size());
    BundleBody body = assertInstanceOf(BundleBody.class, response.observations().get(0));
    assertTrue(body.render().contains("Users cannot log in."));
    assertTrue(storage.exists("v1/resource/jira/ISSUE/ISSUE-1.yml"));
    assertTrue(storage.exists("v1/observed/jira+ISSUE+ISSUE-1/body.yml"));
    assertEquals(1, seen.size());
  }

  @Test
  @DisplayName("A cache-only load after the first one needs no network")
  void cacheOnlyReload() {
    load(LoadMode.AUTO);

    QueryResponse response = load(LoadMode.NONE);

    assertEquals(List.of(), response.errors());
    assertEquals("ISSUE-1: Login fails", response.resources().get(0).metadata().name());
    assertEquals(1, seen.size());
  }

  @Test
  @DisplayName("An unchanged revision keeps the stored history as it is")
  void unchangedRevisionIsNotRewritten() {
    load(LoadMode.AUTO);
    byte[] stored = storage.get("v1/resource/jira/ISSUE/ISSUE-1.yml");

    QueryResponse response = load(LoadMode.AUTO);

    assertEquals(List.of(), response.errors());
    assertArrayEquals(stored, storage.get("v1/resource/jira/ISSUE/ISSUE-1.yml"));
    assertEquals(2, seen.size());
  }
}
