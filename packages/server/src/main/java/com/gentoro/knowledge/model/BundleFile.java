package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.AffordanceUri;
import java.time.Instant;
import java.util.List;

/** Download reference for the raw file behind a resource. */
public record BundleFile(
    AffordanceUri uri,
    String description,
    String mimeType,
    Long size,
    Instant expiry,
    String downloadUrl)
    implements Bundle {

  @Override
  public List<ObservationInfo> tableOfContents() {
    return List.of();
  }
}
