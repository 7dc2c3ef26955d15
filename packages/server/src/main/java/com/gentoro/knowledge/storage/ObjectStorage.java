package com.gentoro.knowledge.storage;

import java.util.List;

/**
 * Flat key/value blob store. Keys are {@code /}-separated paths. Implementations must make {@link
 * #put} atomic per key: a reader sees either the old or the new value, never a partial write.
 */
public interface ObjectStorage {

  /** The stored bytes, or {@code null} when the key does not exist. */
  byte[] get(String key);

  void put(String key, byte[] value);

  /** Returns {@code true} when something was deleted. */
  boolean delete(String key);

  boolean exists(String key);

  /** Keys starting with {@code prefix}, sorted. */
  List<String> list(String prefix);
}
