package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;
import java.util.Objects;

public record RelationParent(ResourceUri parent, ResourceUri child) implements Relation {
  public RelationParent {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(child, "child");
  }

  @Override
  public RelationType type() {
    return RelationType.PARENT;
  }

  @Override
  public List<ResourceUri> nodes() {
    return List.of(parent, child);
  }
}
