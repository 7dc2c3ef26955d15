package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gentoro.knowledge.uri.ResourceUri;
import com.gentoro.knowledge.utility.JacksonUtility;
import com.gentoro.knowledge.utility.UniqueIds;
import java.util.List;

/**
 * Directed edge between two resources, logically visible from both ends. Persisted once under its
 * {@link #uniqueId()} and indexed from every node.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = RelationParent.class, name = "parent"),
  @JsonSubTypes.Type(value = RelationLink.class, name = "link"),
  @JsonSubTypes.Type(value = RelationEmbed.class, name = "embed"),
  @JsonSubTypes.Type(value = RelationMisc.class, name = "misc")
})
public interface Relation {
  String ID_SALT = "knowledge-relation";

  RelationType type();

  /** The endpoints, source first. */
  List<ResourceUri> nodes();

  default boolean involves(ResourceUri uri) {
    return nodes().contains(uri);
  }

  /** {@code type-<32 hex>}, derived from the canonical JSON of the relation. */
  default String uniqueId() {
    String canonical = JacksonUtility.toCanonicalJson(this);
    return type().tag() + "-" + UniqueIds.fromString(canonical, 32, ID_SALT);
  }
}
