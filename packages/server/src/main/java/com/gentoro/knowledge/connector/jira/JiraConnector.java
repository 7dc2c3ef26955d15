package com.gentoro.knowledge.connector.jira;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ObserveOptions;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.exception.UnavailableException;
import com.gentoro.knowledge.model.BundleCollection;
import com.gentoro.knowledge.model.Fragment;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.RelationMisc;
import com.gentoro.knowledge.model.RelationParent;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.Reference;
import com.gentoro.knowledge.uri.ResourceUri;
import com.gentoro.knowledge.utility.StringUtility;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.OkHttpClient;

/**
 * Connector for Jira Cloud and Server. Issues are read through {@code /rest/api/2/issue} and
 * rendered as markdown; saved filters expose their search results as a collection.
 */
public class JiraConnector implements Connector {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(JiraConnector.class);

  private static final Pattern URL_ISSUE = Pattern.compile("/browse/([A-Za-z][A-Za-z0-9]*-\\d+)");
  private static final Pattern URL_ISSUES = Pattern.compile("/issues/?");
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final DateTimeFormatter JIRA_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
  private static final Set<String> LINKS_TO_PARENT = Set.of("is child task of");
  private static final Set<String> LINKS_TO_CHILD = Set.of("child issues", "is parent task of");
  private static final int SEARCH_MAX_RESULTS = 1000;

  private final String realm;
  private final String domain;
  private final String publicUsernameVar;
  private final String publicTokenVar;
  private final int maxConcurrency;
  private final JiraClient client;

  public JiraConnector(
      String realm,
      String domain,
      String publicUsernameVar,
      String publicTokenVar,
      int maxConcurrency,
      OkHttpClient http) {
    this.realm = realm;
    this.domain = domain.toLowerCase(Locale.ROOT);
    this.publicUsernameVar = publicUsernameVar;
    this.publicTokenVar = publicTokenVar;
    this.maxConcurrency = maxConcurrency;
    this.client = new JiraClient(this.domain, http);
  }

  @Override
  public String realm() {
    return realm;
  }

  @Override
  public int maxConcurrency() {
    return maxConcurrency;
  }

  @Override
  public List<Class<? extends Locator>> locatorTypes() {
    return List.of(JiraIssueLocator.class, JiraFilterLocator.class);
  }

  @Override
  public Locator locate(Reference reference, ConnectorContext context) {
    if (reference instanceof ExternalUri url) {
      return locateUrl(url);
    }
    if (reference instanceof KnowledgeUri uri) {
      return locateUri(uri.resourceUri());
    }
    return null;
  }

  private Locator locateUrl(ExternalUri url) {
    if (!url.scheme().startsWith("http") || !domain.equals(url.host())) {
      return null;
    }
    Matcher issue = URL_ISSUE.matcher(url.path());
    if (issue.matches()) {
      return JiraIssueLocator.fromIssueKey(realm, domain, issue.group(1));
    }
    if (URL_ISSUES.matcher(url.path()).matches()) {
      String filter = url.queryParameter("filter");
      if (filter != null && DIGITS.matcher(filter).matches()) {
        return new JiraFilterLocator(realm, domain, filter);
      }
    }
    throw new UnavailableException(
        "Jira page is not supported: " + url, Map.of("url", url.toString()));
  }

  private Locator locateUri(ResourceUri uri) {
    if (!realm.equals(uri.realm()) || uri.path().size() != 1) {
      return null;
    }
    String last = uri.path().get(0);
    if (JiraFilterLocator.SUBREALM.equals(uri.subrealm())) {
      return DIGITS.matcher(last).matches() ? new JiraFilterLocator(realm, domain, last) : null;
    }
    JiraIssueLocator issue = JiraIssueLocator.fromIssueKey(realm, domain, last);
    if (issue != null && !issue.projectKey().equals(uri.subrealm())) {
      log.debug(
          "Filing {} under project {} instead of '{}'", last, issue.projectKey(), uri.subrealm());
    }
    return issue;
  }

  @Override
  public ResolveResult resolve(Locator locator, ResourceView cached, ConnectorContext context) {
    if (locator instanceof JiraIssueLocator issueLocator) {
      JiraIssue issue = fetchIssue(issueLocator, context);
      String prefix =
          "Issue of type %s, status %s, priority %s"
              .formatted(issue.issueType(), issue.status(), issue.priority());
      MetadataDelta.Builder metadata =
          MetadataDelta.builder()
              .name(issue.key() + ": " + issue.summary())
              .mimeType("text/markdown")
              .citationUrl(issueLocator.citationUrl())
              .createdAt(parseTimestamp(issue.created()))
              .updatedAt(parseTimestamp(issue.updated()))
              .revisionData(issue.updated().isEmpty() ? null : issue.updated())
              .description(
                  StringUtility.shortenDescription(
                      issue.description().isEmpty()
                          ? prefix
                          : prefix + ": " + issue.description()));
      if (cached == null || !cached.metadata().supports(Affordance.BODY)) {
        metadata.affordances(Affordance.BODY);
      }
      return ResolveResult.of(metadata.build(), true);
    }
    if (locator instanceof JiraFilterLocator filterLocator) {
      JsonNode filter = fetchFilter(filterLocator, context);
      MetadataDelta.Builder metadata =
          MetadataDelta.builder()
              .name(JiraIssue.text(filter, "Filter " + filterLocator.filterId(), "name"))
              .citationUrl(filterLocator.citationUrl())
              .description(
                  StringUtility.shortenDescription("JQL: " + JiraIssue.text(filter, "", "jql")));
      if (cached == null || !cached.metadata().supports(Affordance.COLLECTION)) {
        metadata.affordances(Affordance.COLLECTION);
      }
      return ResolveResult.of(metadata.build(), true);
    }
    throw new UnavailableException("Unsupported locator for Jira: " + locator);
  }

  @Override
  public ObserveResult observe(
      Locator locator, Observable observable, MetadataDelta resolved, ConnectorContext context) {
    if (locator instanceof JiraIssueLocator issueLocator
        && observable.equals(Observable.of(Affordance.BODY))) {
      return readIssueBody(issueLocator, context);
    }
    if (locator instanceof JiraFilterLocator filterLocator
        && observable.equals(Observable.of(Affordance.COLLECTION))) {
      return readFilterCollection(filterLocator, context);
    }
    throw new UnavailableException(
        "Jira cannot observe %s on %s".formatted(observable, locator.resourceUri()));
  }

  private ObserveResult readIssueBody(JiraIssueLocator locator, ConnectorContext context) {
    JiraIssue issue = fetchIssue(locator, context);
    ResourceUri self = locator.resourceUri();
    List<Relation> relations = new ArrayList<>();
    if (issue.parent() != null) {
      JiraIssueLocator parent = JiraIssueLocator.fromIssueKey(realm, domain, issue.parent().key());
      if (parent != null) {
        relations.add(new RelationParent(parent.resourceUri(), self));
      }
    }
    for (JiraIssue.RelatedIssue related : issue.relatedIssues()) {
      JiraIssueLocator other = JiraIssueLocator.fromIssueKey(realm, domain, related.key());
      if (other == null) {
        log.debug("Skipping link to malformed issue key '{}' from {}", related.key(), self);
        continue;
      }
      ResourceUri target = other.resourceUri();
      if (LINKS_TO_PARENT.contains(related.linkType())) {
        relations.add(new RelationParent(target, self));
      } else if (LINKS_TO_CHILD.contains(related.linkType())) {
        relations.add(new RelationParent(self, target));
      } else {
        relations.add(RelationMisc.of(related.linkType(), self, target));
      }
    }
    return new ObserveResult(
        Fragment.markdown(JiraMarkdown.render(domain, issue)),
        null,
        relations,
        true,
        ObserveOptions.DEFAULT.withRelationsLink(true));
  }

  private ObserveResult readFilterCollection(JiraFilterLocator locator, ConnectorContext context) {
    JsonNode filter = fetchFilter(locator, context);
    String jql = JiraIssue.text(filter, "", "jql");
    if (jql.isEmpty()) {
      throw new UnavailableException("Jira filter has no JQL: " + locator.filterId());
    }
    JsonNode results =
        client.get(
            "rest/api/2/search",
            Map.of("jql", jql, "maxResults", String.valueOf(SEARCH_MAX_RESULTS), "fields", "key"),
            authorization(context));
    List<ResourceUri> uris = new ArrayList<>();
    for (JsonNode item : results.path("issues")) {
      JiraIssueLocator found = JiraIssueLocator.fromIssueKey(realm, domain, item.path("key").asText());
      if (found != null) uris.add(found.resourceUri());
    }
    return new ObserveResult(
        new BundleCollection(locator.resourceUri().child(Affordance.COLLECTION), uris),
        null,
        null,
        false,
        ObserveOptions.DEFAULT);
  }

  private JiraIssue fetchIssue(JiraIssueLocator locator, ConnectorContext context) {
    String key = locator.issueKey();
    return context.memoize(
        "jira:%s:issue:%s".formatted(realm, key),
        () -> {
          context.ensureActive();
          JsonNode data = client.get("rest/api/2/issue/" + key, Map.of(), authorization(context));
          return JiraIssue.parse(key, data);
        });
  }

  private JsonNode fetchFilter(JiraFilterLocator locator, ConnectorContext context) {
    return context.memoize(
        "jira:%s:filter:%s".formatted(realm, locator.filterId()),
        () ->
            client.get(
                "rest/api/2/filter/" + locator.filterId(), Map.of(), authorization(context)));
  }

  private String authorization(ConnectorContext context) {
    return context.basicAuthorization(realm, publicUsernameVar, publicTokenVar).header();
  }

  static Instant parseTimestamp(String value) {
    if (value == null || value.isEmpty()) return null;
    try {
      return OffsetDateTime.parse(value, JIRA_TIMESTAMP).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(value).toInstant();
      } catch (DateTimeParseException ignored) {
        log.debug("Unrecognized Jira timestamp '{}'", value);
        return null;
      }
    }
  }
}
