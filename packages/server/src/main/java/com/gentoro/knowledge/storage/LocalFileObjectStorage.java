package com.gentoro.knowledge.storage;

import com.gentoro.knowledge.exception.StorageException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores each key as a file below a root directory. Writes go to a temporary sibling file that is
 * then moved over the target atomically.
 */
public class LocalFileObjectStorage implements ObjectStorage {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(LocalFileObjectStorage.class);
  private final Path root;

  public LocalFileObjectStorage(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw failure("Unable to create storage root", this.root.toString(), e);
    }
    log.info("Local object storage rooted at {}", this.root);
  }

  public Path getRoot() {
    return root;
  }

  @Override
  public byte[] get(String key) {
    Path file = resolve(key);
    try {
      return Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      throw failure("Unable to read object", key, e);
    }
  }

  @Override
  public void put(String key, byte[] value) {
    Path file = resolve(key);
    Path temp = null;
    try {
      Files.createDirectories(file.getParent());
      temp = Files.createTempFile(file.getParent(), ".tmp-", ".part");
      Files.write(temp, value);
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      log.trace("LocalFileObjectStorage: put {} ({} bytes)", key, value.length);
    } catch (IOException e) {
      cleanup(temp);
      throw failure("Unable to write object", key, e);
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      return Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      throw failure("Unable to delete object", key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public List<String> list(String prefix) {
    int slash = prefix.lastIndexOf('/');
    Path dir = slash < 0 ? root : resolve(prefix.substring(0, slash));
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    List<String> keys = new ArrayList<>();
    try (Stream<Path> files = Files.walk(dir)) {
      files
          .filter(Files::isRegularFile)
          .map(p -> root.relativize(p).toString().replace('\\', '/'))
          .filter(k -> k.startsWith(prefix) && !isTemp(k))
          .sorted()
          .forEach(keys::add);
    } catch (IOException e) {
      throw failure("Unable to list objects", prefix, e);
    }
    return keys;
  }

  private Path resolve(String key) {
    Path file = root.resolve(key).normalize();
    if (!file.startsWith(root)) {
      throw StorageException.permanentFailure("Key escapes the storage root", key, null);
    }
    return file;
  }

  private static boolean isTemp(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    return name.startsWith(".tmp-") && name.endsWith(".part");
  }

  private static void cleanup(Path temp) {
    if (temp == null) return;
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Unable to remove temporary file {}", temp, e);
    }
  }

  private static StorageException failure(String message, String key, IOException e) {
    if (e instanceof NoSuchFileException || e instanceof AccessDeniedException) {
      return StorageException.permanentFailure(message + ": " + e.getMessage(), key, e);
    }
    return StorageException.transientFailure(message + ": " + e.getMessage(), key, e);
  }
}
