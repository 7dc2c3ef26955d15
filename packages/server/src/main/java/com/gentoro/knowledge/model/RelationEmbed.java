package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;
import java.util.Objects;

/** The content of {@code target} is inlined into {@code source}. */
public record RelationEmbed(ResourceUri source, ResourceUri target) implements Relation {
  public RelationEmbed {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  @Override
  public RelationType type() {
    return RelationType.EMBED;
  }

  @Override
  public List<ResourceUri> nodes() {
    return List.of(source, target);
  }
}
