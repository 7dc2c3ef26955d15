package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Append-only log of {@link ResourceDelta}s describing one resource. The first delta carries the
 * locator; later deltas only record what changed relative to the merged state. Instances are
 * immutable: {@link #update(ResourceDelta)} returns a new history.
 */
public final class ResourceHistory {
  private final List<ResourceDelta> history;

  @JsonCreator
  public ResourceHistory(@JsonProperty("history") List<ResourceDelta> history) {
    if (history == null || history.isEmpty()) {
      throw new ValidationException("A resource history needs at least one delta");
    }
    if (history.get(0).locator() == null) {
      throw new ValidationException("The first delta of a resource history must carry a locator");
    }
    this.history = List.copyOf(history);
  }

  public static ResourceHistory create(ResourceDelta first) {
    return new ResourceHistory(List.of(first));
  }

  @JsonProperty("history")
  public List<ResourceDelta> history() {
    return history;
  }

  public Locator locator() {
    Locator locator = null;
    for (ResourceDelta delta : history) {
      if (delta.locator() != null) locator = delta.locator();
    }
    return locator;
  }

  public ResourceUri uri() {
    return locator().resourceUri();
  }

  /**
   * Appends what {@code delta} changes relative to the merged state. Returns this history when
   * nothing changes.
   */
  public ResourceHistory update(ResourceDelta delta) {
    ResourceView current = merged();
    ResourceDelta reduced = reduce(current, delta);
    if (reduced.isEmpty()) {
      return this;
    }
    List<ResourceDelta> next = new ArrayList<>(history);
    next.add(reduced);
    return new ResourceHistory(next);
  }

  /** Folds every delta into a single view; later observations clear earlier expiries. */
  public ResourceView merged() {
    Locator locator = null;
    MetadataDelta metadata = MetadataDelta.EMPTY;
    Set<Observable> expired = new TreeSet<>();
    Map<String, Label> labels = new LinkedHashMap<>();
    Map<Observable, ObservedDelta> observed = new LinkedHashMap<>();
    Instant refreshedAt = null;
    for (ResourceDelta delta : history) {
      if (delta.locator() != null) locator = delta.locator();
      metadata = metadata.withUpdate(delta.metadata());
      expired.addAll(delta.expired());
      for (Label label : delta.labels()) {
        labels.put(label.key(), label);
      }
      for (ObservedDelta o : delta.observed()) {
        observed.put(o.suffix(), o);
        expired.remove(o.suffix());
      }
      if (delta.refreshedAt() != null) refreshedAt = delta.refreshedAt();
    }
    return new ResourceView(
        locator.resourceUri(),
        locator,
        metadata,
        List.copyOf(expired),
        List.copyOf(labels.values()),
        List.copyOf(observed.values()),
        refreshedAt);
  }

  public List<ExternalUri> allAliases() {
    Set<ExternalUri> aliases = new LinkedHashSet<>();
    for (ResourceDelta delta : history) {
      aliases.addAll(delta.metadata().aliasesOrEmpty());
    }
    return List.copyOf(aliases);
  }

  /** Relations currently attached: the metadata relations plus those of each observed affordance. */
  public List<Relation> allRelations() {
    ResourceView view = merged();
    Set<Relation> relations = new LinkedHashSet<>(view.metadata().relationsOrEmpty());
    for (ObservedDelta o : view.observed()) {
      relations.addAll(o.relations());
    }
    return List.copyOf(relations);
  }

  public List<Label> allLabels() {
    return merged().labels();
  }

  private static ResourceDelta reduce(ResourceView current, ResourceDelta delta) {
    Locator locator = Objects.equals(current.locator(), delta.locator()) ? null : delta.locator();
    Set<Observable> observedNow = new TreeSet<>();
    for (ObservedDelta o : delta.observed()) {
      observedNow.add(o.suffix());
    }
    List<Observable> expired = new ArrayList<>();
    for (Observable o : delta.expired()) {
      if (!current.expired().contains(o) && !observedNow.contains(o)) expired.add(o);
    }
    List<Label> labels = new ArrayList<>();
    for (Label label : delta.labels()) {
      if (!current.labels().contains(label)) labels.add(label);
    }
    List<ObservedDelta> observed = new ArrayList<>();
    for (ObservedDelta o : delta.observed()) {
      if (!current.observed().contains(o) || current.expired().contains(o.suffix())) {
        observed.add(o);
      }
    }
    return new ResourceDelta(
        delta.refreshedAt(),
        locator,
        expired,
        labels,
        current.metadata().diff(delta.metadata()),
        observed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResourceHistory other)) return false;
    return history.equals(other.history);
  }

  @Override
  public int hashCode() {
    return history.hashCode();
  }

  @Override
  public String toString() {
    return "ResourceHistory{uri=" + uri() + ", deltas=" + history.size() + "}";
  }
}
