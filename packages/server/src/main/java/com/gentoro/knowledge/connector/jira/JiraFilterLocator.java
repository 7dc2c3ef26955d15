package com.gentoro.knowledge.connector.jira;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.ResourceUri;

/** A saved Jira filter, addressed as {@code ndk://{realm}/filter/{id}}; exposes {@code $collection}. */
@JsonTypeName("jira_filter")
public record JiraFilterLocator(String realm, String domain, String filterId) implements Locator {
  static final String SUBREALM = "filter";

  @Override
  public ResourceUri resourceUri() {
    return ResourceUri.of(realm, SUBREALM, filterId);
  }

  @Override
  public String citationUrl() {
    return "https://" + domain + "/issues/?filter=" + filterId;
  }
}
