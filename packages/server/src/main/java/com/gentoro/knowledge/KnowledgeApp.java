package com.gentoro.knowledge;

import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.query.QueryRequest;
import com.gentoro.knowledge.query.QueryResponse;
import com.gentoro.knowledge.utility.JacksonUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class KnowledgeApp {

  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(KnowledgeApp.class);

  static final String USAGE =
      """
      Usage: knowledge-server [--config-file <location>] --mode <query|help> [--input <batch.json>]

        --config-file  classpath:application.yaml (default), a file: URI or a path
        --mode query   run the batch read from --input and print the response as JSON
        --mode help    print this message
      """;

  public static void main(String[] args) {
    try {
      System.exit(run(args, System.out));
    } catch (Exception e) {
      log.error("Application failed", e);
      System.exit(1);
    }
  }

  static int run(String[] args, PrintStream out) {
    StartupParameters parameters;
    try {
      parameters = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      out.println(e.getMessage());
      out.print(USAGE);
      return 2;
    }
    if ("help".equals(parameters.mode())) {
      out.print(USAGE);
      return 0;
    }

    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    ConfigurationProvider configuration = new ConfigurationProvider(parameters.configFile());
    com.gentoro.knowledge.logging.LoggingService.applyConfiguration(configuration.config());
    KnowledgeSettings settings = configuration.settings();

    QueryRequest request = readRequest(Path.of(parameters.getParameter("input", String.class)));
    try (KnowledgeServer server = new KnowledgeServer(settings, configuration.environment())) {
      QueryResponse response = server.queryService().execute(request, Map.of());
      out.println(JacksonUtility.toJson(response));
      return response.errors().isEmpty() ? 0 : 3;
    }
  }

  private static QueryRequest readRequest(Path input) {
    try {
      return JacksonUtility.getJsonMapper().readValue(Files.readString(input), QueryRequest.class);
    } catch (IOException e) {
      throw new ConfigException("Cannot read the query batch from " + input, e);
    }
  }
}
