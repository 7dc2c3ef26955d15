package com.gentoro.knowledge.model;

/** Derives the one-line summary shown for a chunk in a table of contents. */
public final class ChunkDescriptions {
  static final int MAX_LENGTH = 120;

  private ChunkDescriptions() {}

  /** The first heading when the chunk starts with one, otherwise its first non-blank line. */
  public static String summarize(String text) {
    if (text == null) return null;
    for (String line : text.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) continue;
      String stripped = trimmed.replaceFirst("^#{1,6}\\s+", "");
      return stripped.length() <= MAX_LENGTH
          ? stripped
          : stripped.substring(0, MAX_LENGTH - 3).trim() + "...";
    }
    return null;
  }
}
