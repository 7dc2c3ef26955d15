package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FragmentMode {
  /** Kept verbatim. */
  PLAIN,
  /** Structured text (JSON, YAML...) whose links are still rewritten. */
  DATA,
  /** Markdown with optional embedded blobs. */
  MARKDOWN;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static FragmentMode fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
