package com.gentoro.knowledge;

import com.gentoro.knowledge.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the knowledge server YAML and turns it into {@link KnowledgeSettings}.
 *
 * <p>The location is {@code classpath:<resource>}, a {@code file:} URI or a filesystem path.
 * Values may reference {@code ${env:NAME}}. Names are looked up in the process environment first,
 * then in the dotenv file named by {@value #ENV_FILE_VARIABLE} (default {@value
 * #DEFAULT_ENV_FILE}). Connector credentials are read through the same {@link #environment()}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String ENV_FILE_VARIABLE = "KNOWLEDGE_ENV_FILE";
  static final String DEFAULT_ENV_FILE = ".env.local";
  private static final String CLASSPATH = "classpath:";

  private final EnvironmentLookup environment;
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, System::getenv);
  }

  ConfigurationProvider(String location, Function<String, String> processEnvironment) {
    this.environment = new EnvironmentLookup(processEnvironment);
    this.configuration = load(location == null || location.isBlank() ? "" : location.trim());
  }

  /** Raw configuration, used for logging levels. */
  public Configuration config() {
    return configuration;
  }

  public KnowledgeSettings settings() {
    return KnowledgeSettings.from(configuration);
  }

  /** Process environment backed by the dotenv file; handed to connectors for credentials. */
  public Function<String, String> environment() {
    return environment;
  }

  private Configuration load(String location) {
    if (location.isEmpty() || location.startsWith(CLASSPATH)) {
      String resource =
          location.isEmpty() ? "application.yaml" : location.substring(CLASSPATH.length());
      InputStream input =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (input == null) {
        log.warn("Configuration resource {} not found on classpath, using defaults", resource);
        return withEnvironment(new YAMLConfiguration());
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      try (InputStream in = input) {
        YAMLConfiguration yaml = new YAMLConfiguration();
        yaml.read(in);
        return withEnvironment(yaml);
      } catch (IOException | ConfigurationException e) {
        throw new ConfigException("Failed to read YAML from classpath resource: " + resource, e);
      }
    }
    Path file =
        location.regionMatches(true, 0, "file:", 0, 5)
            ? Path.of(URI.create(location))
            : Path.of(location);
    log.info("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(reader);
      return withEnvironment(yaml);
    } catch (NoSuchFileException e) {
      throw new ConfigException("Configuration file does not exist: " + file, e);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private Configuration withEnvironment(YAMLConfiguration yaml) {
    yaml.getInterpolator().registerLookup("env", environment);
    return yaml;
  }

  /**
   * One {@code KEY=value} line of a dotenv file, or {@code null} for blank lines, comments and
   * lines without a key. A value wrapped in matching single or double quotes is unquoted.
   */
  static Map.Entry<String, String> parseEnvLine(String line) {
    String trimmed = line.trim();
    int idx = trimmed.indexOf('=');
    if (trimmed.startsWith("#") || idx <= 0) return null;
    String value = trimmed.substring(idx + 1).trim();
    if (value.length() >= 2
        && (value.charAt(0) == '"' || value.charAt(0) == '\'')
        && value.charAt(value.length() - 1) == value.charAt(0)) {
      value = value.substring(1, value.length() - 1);
    }
    return Map.entry(trimmed.substring(0, idx).trim(), value);
  }

  private static final class EnvironmentLookup implements Lookup, Function<String, String> {
    private final Function<String, String> process;
    private Map<String, String> dotenv;

    EnvironmentLookup(Function<String, String> process) {
      this.process = process;
    }

    @Override
    public Object lookup(String key) {
      return apply(key);
    }

    @Override
    public String apply(String key) {
      String value = process.apply(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return dotenv().get(key);
    }

    private synchronized Map<String, String> dotenv() {
      if (dotenv == null) {
        String configured = process.apply(ENV_FILE_VARIABLE);
        Path path =
            Path.of(configured == null || configured.isBlank() ? DEFAULT_ENV_FILE : configured);
        dotenv = read(path);
      }
      return dotenv;
    }

    private static Map<String, String> read(Path path) {
      Map<String, String> values = new HashMap<>();
      if (!Files.isRegularFile(path)) {
        log.debug("No env file at {}, using process variables only", path.toAbsolutePath());
        return values;
      }
      log.info("Reading environment fallbacks from {}", path.toAbsolutePath());
      List<String> lines;
      try {
        lines = Files.readAllLines(path, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new ConfigException("Cannot read env file " + path.toAbsolutePath(), e);
      }
      for (String line : lines) {
        Map.Entry<String, String> entry = parseEnvLine(line);
        if (entry != null) values.put(entry.getKey(), entry.getValue());
      }
      return values;
    }
  }
}
