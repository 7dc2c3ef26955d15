package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gentoro.knowledge.exception.UriFormatException;

/** Names one affordance of a resource, e.g. {@code ndk://jira/PROJ/ISSUE-1/$body}. */
public final class AffordanceUri extends KnowledgeUri {
  private final ResourceUri resource;
  private final Affordance affordance;

  AffordanceUri(ResourceUri resource, Affordance affordance) {
    this.resource = resource;
    this.affordance = affordance;
  }

  @JsonCreator
  public static AffordanceUri parse(String value) {
    KnowledgeUri uri = KnowledgeUri.parse(value);
    if (!(uri instanceof AffordanceUri affordanceUri)) {
      throw new UriFormatException("Expected an affordance URI", value);
    }
    return affordanceUri;
  }

  @Override
  public ResourceUri resourceUri() {
    return resource;
  }

  @Override
  public Observable suffix() {
    return affordance.observable();
  }

  public Affordance affordance() {
    return affordance;
  }

  public ObservableUri child(Observable observable) {
    if (observable.affordance() != affordance || observable.isAffordance()) {
      throw new UriFormatException(
          "Observable does not belong to " + affordance, observable.toString());
    }
    return new ObservableUri(resource, observable);
  }
}
