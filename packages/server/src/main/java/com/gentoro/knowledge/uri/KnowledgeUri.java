package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.UriFormatException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Three-tier address {@code ndk://realm/subrealm/path[/$suffix]}. Without suffix it names a
 * resource, with an affordance suffix an {@link AffordanceUri}, otherwise an {@link ObservableUri}.
 *
 * <p>Parsing is purely syntactic. The scheme and realm are case-normalized to lower case; the
 * remaining segments are case-sensitive.
 */
public abstract class KnowledgeUri implements Reference, Comparable<KnowledgeUri> {
  public static final String PREFIX = "ndk://";

  KnowledgeUri() {}

  /** The resource this URI belongs to (itself for a resource URI). */
  public abstract ResourceUri resourceUri();

  /** The suffix, or {@code null} for a resource URI. */
  public abstract Observable suffix();

  public boolean isResource() {
    return suffix() == null;
  }

  public boolean isAffordance() {
    return suffix() != null && suffix().isAffordance();
  }

  public boolean isObservable() {
    return suffix() != null && !suffix().isAffordance();
  }

  public String realm() {
    return resourceUri().realm();
  }

  @JsonCreator
  public static KnowledgeUri parse(String value) {
    if (value == null || !value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      throw new UriFormatException("Knowledge URIs must start with " + PREFIX, value);
    }
    String rest = value.substring(PREFIX.length());
    int suffixAt = rest.indexOf("/$");
    String resourcePart = suffixAt < 0 ? rest : rest.substring(0, suffixAt);
    List<String> parts = Arrays.asList(resourcePart.split("/", -1));
    if (parts.get(0).isEmpty()) {
      throw new UriFormatException("Missing realm", value);
    }
    if (parts.size() < 3) {
      throw new UriFormatException("Expected realm, subrealm and at least one path segment", value);
    }
    ResourceUri resource =
        ResourceUri.of(
            parts.get(0).toLowerCase(Locale.ROOT), parts.get(1), parts.subList(2, parts.size()));
    if (suffixAt < 0) {
      return resource;
    }
    Observable suffix = Observable.parse(rest.substring(suffixAt + 1));
    return resource.child(suffix);
  }

  @JsonValue
  @Override
  public String toString() {
    Observable suffix = suffix();
    return suffix == null ? resourceUri().toString() : resourceUri() + "/" + suffix;
  }

  @Override
  public int compareTo(KnowledgeUri o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof KnowledgeUri other)) return false;
    return toString().equals(other.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }
}
