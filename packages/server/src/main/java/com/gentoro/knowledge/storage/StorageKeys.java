package com.gentoro.knowledge.storage;

import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;
import com.gentoro.knowledge.utility.UniqueIds;

/** Key layout of the bundle store, optionally below a prefix. */
public final class StorageKeys {
  static final String ALIAS_SALT = "knowledge-alias";

  private final String prefix;

  public StorageKeys(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      this.prefix = "";
    } else {
      String p = prefix.trim();
      while (p.startsWith("/")) p = p.substring(1);
      this.prefix = p.endsWith("/") ? p : p + "/";
    }
  }

  public String prefix() {
    return prefix;
  }

  public String resource(ResourceUri uri) {
    return prefix + "resource/" + uri.storagePath() + ".yml";
  }

  public String observed(ResourceUri uri, Affordance affordance) {
    return prefix + "observed/" + uri.flatKey() + "/" + affordance.keyword() + ".yml";
  }

  public String alias(ExternalUri alias) {
    return prefix + "alias/" + UniqueIds.fromString(alias.toString(), 40, ALIAS_SALT) + ".yml";
  }

  public String relationDefinition(String relationId) {
    return prefix + "relation/defs/" + relationId + ".yml";
  }

  public String relationReference(ResourceUri node, String relationId) {
    return relationReferences(node) + relationId + ".txt";
  }

  public String relationReferences(ResourceUri node) {
    return prefix + "relation/refs/" + node.flatKey() + "/";
  }

  /** Relation id encoded in a reference key. */
  static String relationIdOf(String referenceKey) {
    String name = referenceKey.substring(referenceKey.lastIndexOf('/') + 1);
    return name.endsWith(".txt") ? name.substring(0, name.length() - 4) : name;
  }
}
