package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.Observable;
import java.util.Objects;

/** Additive metadata attached to an observable; several names may target the same observable. */
public record Label(String name, Observable target, String value) {
  public Label {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(target, "target");
  }

  /** Labels are unique per (name, target). */
  String key() {
    return name + "@" + target;
  }
}
