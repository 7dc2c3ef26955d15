package com.gentoro.knowledge.connector;

import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservedContent;
import com.gentoro.knowledge.model.Relation;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Connector#observe}: a raw fragment or a ready bundle, plus metadata and
 * relations discovered while reading it.
 */
public record ObserveResult(
    ObservedContent content,
    MetadataDelta metadata,
    List<Relation> relations,
    boolean shouldCache,
    ObserveOptions options) {

  public ObserveResult {
    Objects.requireNonNull(content, "content");
    metadata = metadata == null ? MetadataDelta.EMPTY : metadata;
    relations = relations == null ? List.of() : List.copyOf(relations);
    options = options == null ? ObserveOptions.DEFAULT : options;
  }

  public static ObserveResult of(ObservedContent content, boolean shouldCache) {
    return new ObserveResult(content, null, null, shouldCache, null);
  }
}
