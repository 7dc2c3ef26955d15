package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.AffordanceUri;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;

/** Ordered children of a container resource. */
public record BundleCollection(AffordanceUri uri, List<ResourceUri> results) implements Bundle {
  public BundleCollection {
    results = results == null ? List.of() : List.copyOf(results);
  }

  @Override
  public String description() {
    return null;
  }

  @Override
  public String mimeType() {
    return null;
  }

  @Override
  public List<ObservationInfo> tableOfContents() {
    return List.of();
  }
}
