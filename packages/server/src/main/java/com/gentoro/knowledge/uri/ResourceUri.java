package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.UriFormatException;
import java.util.List;

/** Names a resource: {@code ndk://realm/subrealm/path...}. */
public final class ResourceUri extends KnowledgeUri {
  private final String realm;
  private final String subrealm;
  private final List<String> path;
  private final String serialized;

  private ResourceUri(String realm, String subrealm, List<String> path) {
    this.realm = realm;
    this.subrealm = subrealm;
    this.path = List.copyOf(path);
    this.serialized = PREFIX + realm + "/" + subrealm + "/" + String.join("/", path);
  }

  /** Builds a resource URI from its parts, validating each of them. */
  public static ResourceUri of(String realm, String subrealm, List<String> path) {
    if (!UriGrammar.isRealm(realm)) {
      throw new UriFormatException("Invalid realm", realm);
    }
    if (!UriGrammar.isSegment(subrealm)) {
      throw new UriFormatException("Invalid subrealm", subrealm);
    }
    if (path == null || path.isEmpty()) {
      throw new UriFormatException("A resource needs at least one path segment", realm);
    }
    for (String segment : path) {
      if (!UriGrammar.isSegment(segment)) {
        throw new UriFormatException("Invalid path segment", segment);
      }
    }
    return new ResourceUri(realm, subrealm, path);
  }

  public static ResourceUri of(String realm, String subrealm, String... path) {
    return of(realm, subrealm, List.of(path));
  }

  @JsonCreator
  public static ResourceUri parse(String value) {
    KnowledgeUri uri = KnowledgeUri.parse(value);
    if (!(uri instanceof ResourceUri resource)) {
      throw new UriFormatException("Expected a resource URI without suffix", value);
    }
    return resource;
  }

  @Override
  public ResourceUri resourceUri() {
    return this;
  }

  @Override
  public Observable suffix() {
    return null;
  }

  @Override
  public String realm() {
    return realm;
  }

  public String subrealm() {
    return subrealm;
  }

  public List<String> path() {
    return path;
  }

  public AffordanceUri child(Affordance affordance) {
    return new AffordanceUri(this, affordance);
  }

  /** Attaches any suffix, returning an affordance or an observable URI as appropriate. */
  public KnowledgeUri child(Observable suffix) {
    if (suffix.isAffordance()) {
      return new AffordanceUri(this, suffix.affordance());
    }
    return new ObservableUri(this, suffix);
  }

  public ObservableUri childObservable(Observable suffix) {
    if (suffix.isAffordance()) {
      throw new UriFormatException("Not an observable suffix", suffix.toString());
    }
    return new ObservableUri(this, suffix);
  }

  /** {@code realm+subrealm+path} with path segments joined by {@code +}. */
  public String flatKey() {
    return realm + "+" + subrealm + "+" + String.join("+", path);
  }

  /** {@code realm/subrealm/path}, the URI without its scheme. */
  public String storagePath() {
    return serialized.substring(PREFIX.length());
  }

  @JsonValue
  @Override
  public String toString() {
    return serialized;
  }
}
