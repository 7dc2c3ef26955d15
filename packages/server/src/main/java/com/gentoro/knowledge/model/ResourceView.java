package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.time.Instant;
import java.util.List;

/** Read-only merged snapshot of a resource history. */
public record ResourceView(
    ResourceUri uri,
    Locator locator,
    MetadataDelta metadata,
    List<Observable> expired,
    List<Label> labels,
    List<ObservedDelta> observed,
    Instant refreshedAt) {

  public ResourceView {
    metadata = metadata == null ? MetadataDelta.EMPTY : metadata;
    expired = expired == null ? List.of() : List.copyOf(expired);
    labels = labels == null ? List.of() : List.copyOf(labels);
    observed = observed == null ? List.of() : List.copyOf(observed);
  }

  public ObservedDelta observedFor(Affordance affordance) {
    Observable suffix = Observable.of(affordance);
    for (ObservedDelta delta : observed) {
      if (suffix.equals(delta.suffix())) return delta;
    }
    return null;
  }

  public boolean isExpired(Affordance affordance) {
    return expired.contains(Observable.of(affordance));
  }

  /** An affordance needs observing when it was never observed or its observation expired. */
  public boolean needsObservation(Affordance affordance) {
    return observedFor(affordance) == null || isExpired(affordance);
  }
}
