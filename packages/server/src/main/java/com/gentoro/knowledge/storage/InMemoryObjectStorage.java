package com.gentoro.knowledge.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryObjectStorage implements ObjectStorage {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(InMemoryObjectStorage.class);
  private final ConcurrentSkipListMap<String, byte[]> memory = new ConcurrentSkipListMap<>();

  @Override
  public byte[] get(String key) {
    try {
      byte[] value = memory.get(key);
      return value == null ? null : value.clone();
    } finally {
      log.trace("InMemoryObjectStorage: get {}", key);
    }
  }

  @Override
  public void put(String key, byte[] value) {
    memory.put(key, value.clone());
    log.trace("InMemoryObjectStorage: put {} ({} bytes)", key, value.length);
  }

  @Override
  public boolean delete(String key) {
    boolean removed = memory.remove(key) != null;
    log.trace("InMemoryObjectStorage: delete {} (removed={})", key, removed);
    return removed;
  }

  @Override
  public boolean exists(String key) {
    return memory.containsKey(key);
  }

  @Override
  public List<String> list(String prefix) {
    log.trace("InMemoryObjectStorage: list {}", prefix);
    List<String> keys = new ArrayList<>();
    for (Map.Entry<String, byte[]> entry : memory.tailMap(prefix, true).entrySet()) {
      if (!entry.getKey().startsWith(prefix)) break;
      keys.add(entry.getKey());
    }
    return keys;
  }

  public void clear() {
    memory.clear();
    log.trace("InMemoryObjectStorage: clear");
  }
}
