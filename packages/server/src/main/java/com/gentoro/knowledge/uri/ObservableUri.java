package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gentoro.knowledge.exception.UriFormatException;

/** Names content inside an affordance, e.g. {@code ndk://files/docs/guide.md/$chunk/01}. */
public final class ObservableUri extends KnowledgeUri {
  private final ResourceUri resource;
  private final Observable observable;

  ObservableUri(ResourceUri resource, Observable observable) {
    this.resource = resource;
    this.observable = observable;
  }

  @JsonCreator
  public static ObservableUri parse(String value) {
    KnowledgeUri uri = KnowledgeUri.parse(value);
    if (!(uri instanceof ObservableUri observableUri)) {
      throw new UriFormatException("Expected an observable URI", value);
    }
    return observableUri;
  }

  @Override
  public ResourceUri resourceUri() {
    return resource;
  }

  @Override
  public Observable suffix() {
    return observable;
  }

  public AffordanceUri parentAffordance() {
    return resource.child(observable.affordance());
  }
}
