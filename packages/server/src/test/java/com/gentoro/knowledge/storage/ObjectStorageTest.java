package com.gentoro.knowledge.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.StorageException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Object storage backends")
class ObjectStorageTest {

  @TempDir Path tempDir;

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  private void exercise(ObjectStorage storage) {
    assertNull(storage.get("v1/resource/a.yml"));
    assertFalse(storage.exists("v1/resource/a.yml"));

    storage.put("v1/resource/a.yml", bytes("first"));
    storage.put("v1/resource/b/c.yml", bytes("second"));
    storage.put("v1/alias/x.yml", bytes("third"));
    storage.put("v1/resource/a.yml", bytes("replaced"));

    assertEquals("replaced", new String(storage.get("v1/resource/a.yml"), StandardCharsets.UTF_8));
    assertTrue(storage.exists("v1/resource/b/c.yml"));
    assertEquals(
        List.of("v1/resource/a.yml", "v1/resource/b/c.yml"), storage.list("v1/resource/"));
    assertEquals(List.of(), storage.list("v1/relation/"));

    assertTrue(storage.delete("v1/resource/a.yml"));
    assertFalse(storage.delete("v1/resource/a.yml"));
    assertEquals(List.of("v1/resource/b/c.yml"), storage.list("v1/resource/"));
  }

  @Test
  @DisplayName("In-memory storage supports get, put, list and delete")
  void inMemory() {
    exercise(new InMemoryObjectStorage());
  }

  @Test
  @DisplayName("Local file storage supports get, put, list and delete")
  void localFiles() {
    exercise(new LocalFileObjectStorage(tempDir));
  }

  @Test
  @DisplayName("Local file storage leaves no temporary files behind")
  void localFilesNoTempLeftovers() throws Exception {
    LocalFileObjectStorage storage = new LocalFileObjectStorage(tempDir);
    storage.put("v1/resource/a.yml", bytes("x"));

    try (var files = Files.list(tempDir.resolve("v1/resource"))) {
      assertEquals(List.of(tempDir.resolve("v1/resource/a.yml")), files.toList());
    }
  }

  @Test
  @DisplayName("Keys escaping the root are refused")
  void refusesEscapingKeys() {
    LocalFileObjectStorage storage = new LocalFileObjectStorage(tempDir);

    assertThrows(StorageException.class, () -> storage.put("../outside.yml", bytes("x")));
  }

  @Test
  @DisplayName("Factory creates the configured backend")
  void factory() {
    assertInstanceOf(InMemoryObjectStorage.class, ObjectStorageFactory.create("memory", null));
    assertInstanceOf(
        LocalFileObjectStorage.class, ObjectStorageFactory.create("LOCAL", tempDir.toString()));
    assertThrows(ConfigException.class, () -> ObjectStorageFactory.create("local", " "));
    assertThrows(ConfigException.class, () -> ObjectStorageFactory.create("s3", "bucket"));
  }
}
