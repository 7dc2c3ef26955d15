package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connector-specific relation, e.g. Jira's "blocks". The kind is normalized to lower case with
 * spaces replaced by underscores.
 */
public record RelationMisc(
    String kind, ResourceUri source, ResourceUri target, Map<String, String> payload)
    implements Relation {
  public RelationMisc {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    kind = normalizeKind(kind);
    payload = payload == null ? Map.of() : Map.copyOf(payload);
  }

  public static RelationMisc of(String kind, ResourceUri source, ResourceUri target) {
    return new RelationMisc(kind, source, target, Map.of());
  }

  public static String normalizeKind(String kind) {
    return kind.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
  }

  @Override
  public RelationType type() {
    return RelationType.MISC;
  }

  @Override
  public List<ResourceUri> nodes() {
    return List.of(source, target);
  }
}
