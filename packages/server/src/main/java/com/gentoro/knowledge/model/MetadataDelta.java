package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Partial update of a resource's attributes. A {@code null} field is absent and leaves the current
 * value untouched when merged; an empty list is a present, empty value.
 */
public record MetadataDelta(
    String name,
    String mimeType,
    String description,
    String citationUrl,
    Instant createdAt,
    Instant updatedAt,
    String revisionData,
    String revisionMeta,
    List<ExternalUri> aliases,
    List<Affordance> affordances,
    List<Relation> relations) {

  public static final MetadataDelta EMPTY = builder().build();

  public MetadataDelta {
    aliases = aliases == null ? null : List.copyOf(aliases);
    affordances = affordances == null ? null : List.copyOf(affordances);
    relations = relations == null ? null : List.copyOf(relations);
  }

  /** Overwrites the fields present in {@code other}, keeping the others. */
  public MetadataDelta withUpdate(MetadataDelta other) {
    if (other == null) return this;
    return new MetadataDelta(
        pick(other.name, name),
        pick(other.mimeType, mimeType),
        pick(other.description, description),
        pick(other.citationUrl, citationUrl),
        pick(other.createdAt, createdAt),
        pick(other.updatedAt, updatedAt),
        pick(other.revisionData, revisionData),
        pick(other.revisionMeta, revisionMeta),
        pick(other.aliases, aliases),
        pick(other.affordances, affordances),
        pick(other.relations, relations));
  }

  /** The fields of {@code newer} that differ from this delta. */
  public MetadataDelta diff(MetadataDelta newer) {
    if (newer == null) return EMPTY;
    return new MetadataDelta(
        changed(name, newer.name),
        changed(mimeType, newer.mimeType),
        changed(description, newer.description),
        changed(citationUrl, newer.citationUrl),
        changed(createdAt, newer.createdAt),
        changed(updatedAt, newer.updatedAt),
        changed(revisionData, newer.revisionData),
        changed(revisionMeta, newer.revisionMeta),
        changed(aliases, newer.aliases),
        changed(affordances, newer.affordances),
        changed(relations, newer.relations));
  }

  @JsonIgnore
  public boolean isEmpty() {
    return equals(EMPTY);
  }

  public boolean supports(Affordance affordance) {
    return affordances != null && affordances.contains(affordance);
  }

  public List<ExternalUri> aliasesOrEmpty() {
    return aliases == null ? List.of() : aliases;
  }

  public List<Affordance> affordancesOrEmpty() {
    return affordances == null ? List.of() : affordances;
  }

  public List<Relation> relationsOrEmpty() {
    return relations == null ? List.of() : relations;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder builder() {
    return new Builder(null);
  }

  private static <T> T pick(T preferred, T fallback) {
    return preferred != null ? preferred : fallback;
  }

  private static <T> T changed(T current, T newer) {
    return Objects.equals(current, newer) ? null : newer;
  }

  public static final class Builder {
    private String name;
    private String mimeType;
    private String description;
    private String citationUrl;
    private Instant createdAt;
    private Instant updatedAt;
    private String revisionData;
    private String revisionMeta;
    private List<ExternalUri> aliases;
    private List<Affordance> affordances;
    private List<Relation> relations;

    private Builder(MetadataDelta from) {
      if (from == null) return;
      name = from.name;
      mimeType = from.mimeType;
      description = from.description;
      citationUrl = from.citationUrl;
      createdAt = from.createdAt;
      updatedAt = from.updatedAt;
      revisionData = from.revisionData;
      revisionMeta = from.revisionMeta;
      aliases = from.aliases;
      affordances = from.affordances;
      relations = from.relations;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder mimeType(String mimeType) {
      this.mimeType = mimeType;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder citationUrl(String citationUrl) {
      this.citationUrl = citationUrl;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder revisionData(String revisionData) {
      this.revisionData = revisionData;
      return this;
    }

    public Builder revisionMeta(String revisionMeta) {
      this.revisionMeta = revisionMeta;
      return this;
    }

    public Builder aliases(List<ExternalUri> aliases) {
      this.aliases = aliases;
      return this;
    }

    public Builder affordances(List<Affordance> affordances) {
      this.affordances = affordances;
      return this;
    }

    public Builder affordances(Affordance... affordances) {
      this.affordances = List.of(affordances);
      return this;
    }

    public Builder relations(List<Relation> relations) {
      this.relations = relations;
      return this;
    }

    public MetadataDelta build() {
      return new MetadataDelta(
          name,
          mimeType,
          description,
          citationUrl,
          createdAt,
          updatedAt,
          revisionData,
          revisionMeta,
          aliases,
          affordances,
          relations);
    }
  }
}
