package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;
import java.util.Objects;

/** A reference to {@code target} found in the content of {@code source}. */
public record RelationLink(ResourceUri source, ResourceUri target) implements Relation {
  public RelationLink {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  @Override
  public RelationType type() {
    return RelationType.LINK;
  }

  @Override
  public List<ResourceUri> nodes() {
    return List.of(source, target);
  }
}
