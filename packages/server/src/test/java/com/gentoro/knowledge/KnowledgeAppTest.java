package com.gentoro.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Command line entry point")
class KnowledgeAppTest {

  @TempDir Path tempDir;

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Help mode prints the usage")
  void help() {
    assertEquals(0, KnowledgeApp.run(new String[] {"--mode", "help"}, out));
    assertTrue(output().startsWith("Usage: knowledge-server"));
  }

  @Test
  @DisplayName("Invalid arguments print the problem and the usage")
  void invalidArguments() {
    assertEquals(2, KnowledgeApp.run(new String[] {"--mode", "serve"}, out));
    assertTrue(output().startsWith("Invalid mode: serve"));

    buffer.reset();
    assertEquals(2, KnowledgeApp.run(new String[0], out));
    assertTrue(output().contains("Missing --input"));
  }

  @Test
  @DisplayName("Startup parameters keep defaults and parse flag values")
  void startupParameters() {
    StartupParameters parameters =
        new StartupParameters(new String[] {"--input", "batch.json", "stray", "--verbose"});

    assertEquals("query", parameters.mode());
    assertEquals("classpath:application.yaml", parameters.configFile());
    assertEquals("batch.json", parameters.getParameter("input", String.class));
    assertTrue(parameters.isParameterPresent("verbose"));
    assertTrue(parameters.getOptionalParameter("verbose", String.class).isEmpty());
  }

  @Test
  @DisplayName("Query mode runs a batch against the configured connectors")
  void runsBatch() throws Exception {
    Path docs = Files.createDirectories(tempDir.resolve("docs"));
    Files.writeString(docs.resolve("guide.md"), "# Guide\n\nHow to use the service.\n");
    Path config = tempDir.resolve("knowledge.yaml");
    Files.writeString(
        config,
        """
        storage:
          type: memory
          prefix: v1
        connectors:
          files:
            type: files
            volume: docs
            root: "%s"
        """
            .formatted(docs.toString().replace("\\", "/")));
    Path input = tempDir.resolve("batch.json");
    Files.writeString(
        input,
        """
        {
          "actions": [
            {"method": "resources/load", "uri": "ndk://files/docs/guide.md", "observe": ["$body"]}
          ]
        }
        """);

    int status =
        KnowledgeApp.run(
            new String[] {"--config-file", config.toString(), "--input", input.toString()}, out);

    assertEquals(0, status, output());
    assertTrue(output().contains("ndk://files/docs/guide.md/$body"), output());
    assertTrue(output().contains("How to use the service."), output());
  }
}
