package com.gentoro.knowledge.model;

import java.util.List;

/** A heading spanning the chunks whose indexes start with {@code indexes}. */
public record BodySection(List<Integer> indexes, String heading) {
  public BodySection {
    indexes = List.copyOf(indexes);
  }
}
