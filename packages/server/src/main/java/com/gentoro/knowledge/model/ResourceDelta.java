package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.knowledge.uri.Observable;
import java.time.Instant;
import java.util.List;

/** One timestamped entry of a {@link ResourceHistory}. */
public record ResourceDelta(
    Instant refreshedAt,
    Locator locator,
    List<Observable> expired,
    List<Label> labels,
    MetadataDelta metadata,
    List<ObservedDelta> observed) {

  public ResourceDelta {
    expired = expired == null ? List.of() : List.copyOf(expired);
    labels = labels == null ? List.of() : List.copyOf(labels);
    metadata = metadata == null ? MetadataDelta.EMPTY : metadata;
    observed = observed == null ? List.of() : List.copyOf(observed);
  }

  /** True when nothing besides the timestamp would be recorded. */
  @JsonIgnore
  public boolean isEmpty() {
    return locator == null
        && expired.isEmpty()
        && labels.isEmpty()
        && metadata.isEmpty()
        && observed.isEmpty();
  }
}
