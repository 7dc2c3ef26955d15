package com.gentoro.knowledge.storage;

import com.gentoro.knowledge.exception.ConfigException;
import java.nio.file.Path;
import java.util.Locale;

public final class ObjectStorageFactory {
  private ObjectStorageFactory() {}

  /** Creates the backend named by {@code storage.type}: {@code memory} or {@code local}. */
  public static ObjectStorage create(String type, String rootDir) {
    String normalized = type == null ? "memory" : type.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "memory" -> new InMemoryObjectStorage();
      case "local" -> {
        if (rootDir == null || rootDir.isBlank()) {
          throw new ConfigException("storage.root-dir is required when storage.type is 'local'");
        }
        yield new LocalFileObjectStorage(Path.of(rootDir));
      }
      default -> throw new ConfigException("Unsupported storage.type: " + type);
    };
  }
}
