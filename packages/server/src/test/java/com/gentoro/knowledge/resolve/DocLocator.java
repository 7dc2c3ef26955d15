package com.gentoro.knowledge.resolve;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.ResourceUri;

/** Minimal locator for engine tests: {@code ndk://{realm}/docs/{id}}. */
@JsonTypeName("doc")
public record DocLocator(String realm, String id) implements Locator {
  @Override
  public ResourceUri resourceUri() {
    return ResourceUri.of(realm, "docs", id);
  }
}
