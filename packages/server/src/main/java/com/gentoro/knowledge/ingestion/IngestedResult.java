package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservedDelta;
import com.gentoro.knowledge.model.Relation;
import java.util.List;

/**
 * An observation after ingestion: the bundle to store, its summary for the history, the metadata
 * updated with what the observation revealed, and every relation found along the way.
 */
public record IngestedResult(
    Bundle bundle,
    ObservedDelta observed,
    MetadataDelta metadata,
    List<Relation> relations,
    boolean shouldCache) {

  public IngestedResult {
    relations = relations == null ? List.of() : List.copyOf(relations);
  }
}
