package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.Observable;
import java.util.List;

/** What the history remembers about one observed affordance. */
public record ObservedDelta(
    Observable suffix,
    String mimeType,
    String description,
    List<BodySection> sections,
    List<ObservationInfo> observations,
    List<Relation> relations) {

  public ObservedDelta {
    sections = sections == null ? List.of() : List.copyOf(sections);
    observations = observations == null ? List.of() : List.copyOf(observations);
    relations = relations == null ? List.of() : List.copyOf(relations);
  }

  /** Summary of a bundle as recorded in the history. */
  public static ObservedDelta of(Bundle bundle, List<Relation> relations) {
    List<BodySection> sections = bundle instanceof BundleBody body ? body.sections() : List.of();
    return new ObservedDelta(
        bundle.uri().suffix(),
        bundle.mimeType(),
        bundle.description(),
        sections,
        bundle.tableOfContents(),
        relations);
  }
}
