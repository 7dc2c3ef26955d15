package com.gentoro.knowledge.connector.jira;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A Jira issue, addressed as {@code ndk://{realm}/{PROJECT}/{KEY-N}}. */
@JsonTypeName("jira_issue")
public record JiraIssueLocator(String realm, String domain, String projectKey, String issueKey)
    implements Locator {
  static final Pattern ISSUE_KEY = Pattern.compile("([A-Za-z][A-Za-z0-9]*)-(\\d+)");

  /**
   * Locator for {@code PROJ-123}, filed under the project encoded in the key. Returns {@code null}
   * when the key is malformed.
   */
  public static JiraIssueLocator fromIssueKey(String realm, String domain, String issueKey) {
    String key = normalizeKey(issueKey);
    if (key == null) return null;
    return new JiraIssueLocator(realm, domain, key.substring(0, key.lastIndexOf('-')), key);
  }

  /** Upper-cased key, or {@code null} when it is not of the form {@code ABC-123}. */
  static String normalizeKey(String issueKey) {
    if (issueKey == null) return null;
    Matcher m = ISSUE_KEY.matcher(issueKey.trim());
    return m.matches() ? issueKey.trim().toUpperCase(Locale.ROOT) : null;
  }

  @Override
  public ResourceUri resourceUri() {
    return ResourceUri.of(realm, projectKey, issueKey);
  }

  @Override
  public String citationUrl() {
    return "https://" + domain + "/browse/" + issueKey;
  }
}
