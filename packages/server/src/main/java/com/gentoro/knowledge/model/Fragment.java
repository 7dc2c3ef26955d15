package com.gentoro.knowledge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw content produced by a connector, before ingestion. Blobs are keyed by the reference used in
 * the text (for markdown, the target of {@code ![alt](ref)}). Fragments are never persisted.
 */
public record Fragment(FragmentMode mode, String text, Map<String, FragmentBlob> blobs)
    implements ObservedContent {

  public Fragment {
    if (mode == null) {
      throw new IllegalArgumentException("Fragment mode is required");
    }
    text = text == null ? "" : text;
    blobs = blobs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(blobs));
  }

  public static Fragment markdown(String text) {
    return new Fragment(FragmentMode.MARKDOWN, text, Map.of());
  }

  public static Fragment plain(String text) {
    return new Fragment(FragmentMode.PLAIN, text, Map.of());
  }

  public static Fragment data(String text) {
    return new Fragment(FragmentMode.DATA, text, Map.of());
  }
}
