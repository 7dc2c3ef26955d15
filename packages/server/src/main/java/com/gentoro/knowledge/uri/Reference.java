package com.gentoro.knowledge.uri;

/** Anything a caller may use to point at a resource: a knowledge URI or an external URL. */
public interface Reference {

  /** Parses {@code ndk://} strings as {@link KnowledgeUri}, anything else as {@link ExternalUri}. */
  static Reference parse(String value) {
    if (value != null && value.regionMatches(true, 0, KnowledgeUri.PREFIX, 0, 6)) {
      return KnowledgeUri.parse(value);
    }
    return ExternalUri.parse(value);
  }
}
