package com.gentoro.knowledge.resolve;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.ValidationException;
import java.util.Locale;

/** How a request trades cached data against fresh reads. */
public enum LoadMode {
  /** Ask the connector for fresh metadata and re-read only what changed. */
  AUTO,
  /** Re-read everything requested, ignoring revision tags. */
  FORCE,
  /** Serve cached data only; never contact the external system. */
  NONE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static LoadMode parse(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    for (LoadMode mode : values()) {
      if (mode.value().equalsIgnoreCase(value.trim())) {
        return mode;
      }
    }
    throw new ValidationException("Unknown load mode: " + value);
  }
}
