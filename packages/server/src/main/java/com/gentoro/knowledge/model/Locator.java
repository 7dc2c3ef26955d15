package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gentoro.knowledge.uri.ResourceUri;

/**
 * Connector-private handle for a resource. Each connector declares its own implementations (named
 * with {@code @JsonTypeName}) and registers them through {@code Connector.locatorTypes()} so that
 * stored histories can be read back.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
public interface Locator {

  String realm();

  /** Canonical resource URI; must be a pure function of the locator's fields. */
  ResourceUri resourceUri();

  /** Web address a reader can follow, when the source has one. */
  default String citationUrl() {
    return null;
  }
}
