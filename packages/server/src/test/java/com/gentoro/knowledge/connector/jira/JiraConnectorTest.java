package com.gentoro.knowledge.connector.jira;

import static com.gentoro.knowledge.connector.jira.JiraFixtures.DOMAIN;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.connector.jira.JiraFixtures.Canned;
import com.gentoro.knowledge.exception.ForbiddenException;
import com.gentoro.knowledge.exception.NetworkException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.RateLimitedException;
import com.gentoro.knowledge.exception.UnavailableException;
import com.gentoro.knowledge.model.BundleCollection;
import com.gentoro.knowledge.model.Fragment;
import com.gentoro.knowledge.model.FragmentMode;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.RelationMisc;
import com.gentoro.knowledge.model.RelationParent;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JiraConnector")
class JiraConnectorTest {

  private static final Map<String, String> ENV =
      Map.of("JIRA_USERNAME", "bot@example.com", "JIRA_API_TOKEN", "secret");

  private Map<String, Canned> responses;
  private List<Request> seen;
  private JiraConnector connector;

  @BeforeEach
  void setUp() {
    responses = new HashMap<>();
    seen = new ArrayList<>();
    connector =
        new JiraConnector(
            "jira", DOMAIN, "JIRA_USERNAME", "JIRA_API_TOKEN", 2, JiraFixtures.client(responses, seen));
  }

  private static ConnectorContext serverContext() {
    return new ConnectorContext(Map.of(), ENV::get);
  }

  private static String basic(String user, String password) {
    return "Basic "
        + Base64.getEncoder()
            .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Browse URLs of the configured domain are claimed")
  void locatesIssueUrls() {
    Locator locator =
        connector.locate(ExternalUri.parse("https://" + DOMAIN + "/browse/proj-12"), serverContext());

    assertEquals(new JiraIssueLocator("jira", DOMAIN, "PROJ", "PROJ-12"), locator);
    assertEquals("ndk://jira/PROJ/PROJ-12", locator.resourceUri().toString());
    assertEquals("https://" + DOMAIN + "/browse/PROJ-12", locator.citationUrl());
  }

  @Test
  @DisplayName("Filter URLs and filter URIs map to a filter locator")
  void locatesFilters() {
    JiraFilterLocator expected = new JiraFilterLocator("jira", DOMAIN, "10042");

    assertEquals(
        expected,
        connector.locate(
            ExternalUri.parse("https://" + DOMAIN + "/issues/?filter=10042"), serverContext()));
    assertEquals(
        expected, connector.locate(KnowledgeUri.parse("ndk://jira/filter/10042"), serverContext()));
  }

  @Test
  @DisplayName("Knowledge URIs file the normalized key under the project of the key")
  void locatesKnowledgeUris() {
    Locator browsed =
        connector.locate(
            ExternalUri.parse("https://" + DOMAIN + "/browse/PROJ-1"), serverContext());

    assertEquals(
        new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1"),
        connector.locate(KnowledgeUri.parse("ndk://jira/ISSUE/issue-1/$body"), serverContext()));
    assertEquals(
        browsed, connector.locate(KnowledgeUri.parse("ndk://jira/OTHER/PROJ-1"), serverContext()));
    assertEquals("ndk://jira/PROJ/PROJ-1", browsed.resourceUri().toString());
    assertNull(connector.locate(KnowledgeUri.parse("ndk://files/docs/a.md"), serverContext()));
    assertNull(connector.locate(KnowledgeUri.parse("ndk://jira/PROJ/not_a_key"), serverContext()));
  }

  @Test
  @DisplayName("Foreign hosts are ignored, unsupported pages of the domain are refused")
  void refusesOtherPages() {
    assertNull(connector.locate(ExternalUri.parse("https://other.net/browse/PROJ-1"), serverContext()));
    assertThrows(
        UnavailableException.class,
        () ->
            connector.locate(
                ExternalUri.parse("https://" + DOMAIN + "/wiki/spaces/X"), serverContext()));
  }

  @Test
  @DisplayName("Resolving an issue reports metadata, revision and the body affordance")
  void resolvesIssue() {
    responses.put(
        "/rest/api/2/issue/ISSUE-1",
        Canned.ok(JiraFixtures.issueJson("ISSUE-1", "Login fails", "2024-01-03T03:04:05.000+0000")));
    JiraIssueLocator locator = new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1");

    ResolveResult result = connector.resolve(locator, null, serverContext());

    MetadataDelta metadata = result.metadata();
    assertEquals("ISSUE-1: Login fails", metadata.name());
    assertEquals("2024-01-03T03:04:05.000+0000", metadata.revisionData());
    assertEquals(Instant.parse("2024-01-03T03:04:05Z"), metadata.updatedAt());
    assertEquals(List.of(Affordance.BODY), metadata.affordances());
    assertTrue(metadata.description().startsWith("Issue of type Bug, status Open, priority High"));
    assertTrue(result.shouldCache());
    assertEquals(basic("bot@example.com", "secret"), seen.get(0).header("Authorization"));
  }

  @Test
  @DisplayName("The issue body is rendered as markdown with parent and link relations")
  void observesIssueBody() {
    responses.put(
        "/rest/api/2/issue/ISSUE-1",
        Canned.ok(JiraFixtures.issueJson("ISSUE-1", "Login fails", "2024-01-03T03:04:05.000+0000")));
    JiraIssueLocator locator = new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1");
    ConnectorContext context = serverContext();

    connector.resolve(locator, null, context);
    ObserveResult result =
        connector.observe(locator, Observable.of(Affordance.BODY), MetadataDelta.EMPTY, context);

    Fragment fragment = assertInstanceOf(Fragment.class, result.content());
    assertEquals(FragmentMode.MARKDOWN, fragment.mode());
    assertTrue(fragment.text().startsWith("# ISSUE-1: Login fails"), fragment.text());
    assertTrue(fragment.text().contains("Users cannot log in."));
    assertTrue(fragment.text().contains("### Blocks"));
    assertTrue(fragment.text().contains("### Lee @ 2024-01-02"));
    ResourceUri self = locator.resourceUri();
    assertTrue(
        result.relations().contains(new RelationParent(ResourceUri.of("jira", "PROJ", "PROJ-7"), self)));
    assertTrue(
        result.relations().contains(RelationMisc.of("blocks", self, ResourceUri.of("jira", "PROJ", "PROJ-2"))));
    assertTrue(result.options().relationsLink());
    assertEquals(1, seen.size(), "The issue is fetched once per request");
  }

  @Test
  @DisplayName("Filters expose their search results as a collection")
  void observesFilterCollection() {
    responses.put("/rest/api/2/filter/10042", Canned.ok("{\"name\": \"My bugs\", \"jql\": \"project = PROJ\"}"));
    responses.put(
        "/rest/api/2/search",
        Canned.ok("{\"issues\": [{\"key\": \"PROJ-1\"}, {\"key\": \"PROJ-2\"}]}"));
    JiraFilterLocator locator = new JiraFilterLocator("jira", DOMAIN, "10042");

    ResolveResult resolved = connector.resolve(locator, null, serverContext());
    ObserveResult observed =
        connector.observe(
            locator, Observable.of(Affordance.COLLECTION), MetadataDelta.EMPTY, serverContext());

    assertEquals("My bugs", resolved.metadata().name());
    assertEquals(List.of(Affordance.COLLECTION), resolved.metadata().affordances());
    BundleCollection collection = assertInstanceOf(BundleCollection.class, observed.content());
    assertEquals(
        List.of(ResourceUri.of("jira", "PROJ", "PROJ-1"), ResourceUri.of("jira", "PROJ", "PROJ-2")),
        collection.results());
    assertEquals("project = PROJ", seen.get(seen.size() - 1).url().queryParameter("jql"));
  }

  @Test
  @DisplayName("Request credentials take precedence over the server account")
  void requestCredentialsWin() {
    responses.put(
        "/rest/api/2/issue/ISSUE-1",
        Canned.ok(JiraFixtures.issueJson("ISSUE-1", "Login fails", "2024-01-03T03:04:05.000+0000")));
    ConnectorContext context = new ConnectorContext(Map.of("jira", "Bearer user-token"), ENV::get);

    connector.resolve(new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1"), null, context);

    assertEquals("Bearer user-token", seen.get(0).header("Authorization"));
  }

  @Test
  @DisplayName("Missing credentials fail before any request is sent")
  void missingCredentials() {
    ConnectorContext context = new ConnectorContext(Map.of(), name -> null);

    assertThrows(
        UnavailableException.class,
        () -> connector.resolve(new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1"), null, context));
    assertTrue(seen.isEmpty());
  }

  @Test
  @DisplayName("HTTP failures map onto the error hierarchy")
  void mapsHttpStatus() {
    JiraIssueLocator locator = new JiraIssueLocator("jira", DOMAIN, "ISSUE", "ISSUE-1");

    assertThrows(NotFoundException.class, () -> connector.resolve(locator, null, serverContext()));
    responses.put("/rest/api/2/issue/ISSUE-1", new Canned(403, "{}"));
    assertThrows(ForbiddenException.class, () -> connector.resolve(locator, null, serverContext()));
    responses.put("/rest/api/2/issue/ISSUE-1", new Canned(429, "{}"));
    assertThrows(RateLimitedException.class, () -> connector.resolve(locator, null, serverContext()));
    responses.put("/rest/api/2/issue/ISSUE-1", new Canned(503, "{}"));
    assertThrows(NetworkException.class, () -> connector.resolve(locator, null, serverContext()));
  }

  @Test
  @DisplayName("Jira timestamps with numeric offsets are parsed")
  void parsesTimestamps() {
    assertEquals(
        Instant.parse("2024-01-02T01:04:05Z"),
        JiraConnector.parseTimestamp("2024-01-02T03:04:05.000+0200"));
    assertEquals(Instant.parse("2024-01-02T03:04:05Z"), JiraConnector.parseTimestamp("2024-01-02T03:04:05Z"));
    assertNull(JiraConnector.parseTimestamp("yesterday"));
    assertNull(JiraConnector.parseTimestamp(""));
  }
}
