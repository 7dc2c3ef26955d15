package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.AffordanceUri;
import java.util.List;

/** Unprocessed text content of a resource. */
public record BundlePlain(AffordanceUri uri, String mimeType, String text) implements Bundle {

  @Override
  public String description() {
    return null;
  }

  @Override
  public List<ObservationInfo> tableOfContents() {
    return List.of();
  }
}
