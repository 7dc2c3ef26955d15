package com.gentoro.knowledge.connector.files;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ObserveOptions;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.exception.IngestionException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.UnavailableException;
import com.gentoro.knowledge.exception.UriFormatException;
import com.gentoro.knowledge.model.BundleCollection;
import com.gentoro.knowledge.model.BundleFile;
import com.gentoro.knowledge.model.BundlePlain;
import com.gentoro.knowledge.model.Fragment;
import com.gentoro.knowledge.model.FragmentBlob;
import com.gentoro.knowledge.model.FragmentMode;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.Reference;
import com.gentoro.knowledge.uri.ResourceUri;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Serves a local directory tree. Directories expose {@code $collection}; markdown and text files
 * expose {@code $body} and {@code $plain}; any other file exposes {@code $file}.
 */
public class LocalFilesConnector implements Connector {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(LocalFilesConnector.class);

  static final long MAX_IMAGE_BYTES = 5L * 1024 * 1024;
  private static final Pattern IMAGE_REF = Pattern.compile("!\\[[^\\]]*]\\(([^)\\s]+)\\)");
  private static final Map<String, String> MIME_TYPES =
      Map.of(
          "md", "text/markdown",
          "markdown", "text/markdown",
          "txt", "text/plain",
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "gif", "image/gif",
          "svg", "image/svg+xml",
          "pdf", "application/pdf",
          "json", "application/json");

  private final String realm;
  private final String volume;
  private final Path root;

  public LocalFilesConnector(String realm, String volume, Path root) {
    this.realm = realm;
    this.volume = volume;
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public String realm() {
    return realm;
  }

  @Override
  public List<Class<? extends Locator>> locatorTypes() {
    return List.of(LocalFileLocator.class);
  }

  @Override
  public Locator locate(Reference reference, ConnectorContext context) {
    if (!(reference instanceof KnowledgeUri uri)) {
      return null;
    }
    ResourceUri resource = uri.resourceUri();
    if (!realm.equals(resource.realm()) || !volume.equals(resource.subrealm())) {
      return null;
    }
    LocalFileLocator locator = new LocalFileLocator(realm, volume, resource.path());
    if (!Files.exists(toPath(locator))) {
      throw new NotFoundException("No such file: " + locator.relativePath());
    }
    return locator;
  }

  @Override
  public ResolveResult resolve(Locator locator, ResourceView cached, ConnectorContext context) {
    LocalFileLocator file = cast(locator);
    Path path = toPath(file);
    BasicFileAttributes attributes = attributes(path);
    MetadataDelta.Builder metadata =
        MetadataDelta.builder()
            .name(path.getFileName().toString())
            .createdAt(attributes.creationTime().toInstant())
            .updatedAt(attributes.lastModifiedTime().toInstant());
    if (attributes.isDirectory()) {
      metadata
          .mimeType("inode/directory")
          .revisionData(
              "dir-%d-%d"
                  .formatted(attributes.lastModifiedTime().toMillis(), children(file).size()))
          .affordances(Affordance.COLLECTION);
    } else {
      metadata
          .mimeType(mimeType(path))
          .revisionData(
              "file-%d-%d".formatted(attributes.lastModifiedTime().toMillis(), attributes.size()))
          .affordances(
              isText(path)
                  ? List.of(Affordance.BODY, Affordance.PLAIN)
                  : List.of(Affordance.FILE));
    }
    return ResolveResult.of(metadata.build(), true);
  }

  @Override
  public ObserveResult observe(
      Locator locator, Observable observable, MetadataDelta resolved, ConnectorContext context) {
    LocalFileLocator file = cast(locator);
    Path path = toPath(file);
    ResourceUri uri = file.resourceUri();
    Affordance affordance = observable.isAffordance() ? observable.affordance() : null;
    if (affordance == Affordance.COLLECTION && Files.isDirectory(path)) {
      return new ObserveResult(
          new BundleCollection(uri.child(Affordance.COLLECTION), children(file)),
          null,
          null,
          true,
          ObserveOptions.DEFAULT.withRelationsParent(true));
    }
    if (affordance == Affordance.BODY && isText(path)) {
      String text = read(path);
      if (!isMarkdown(path)) {
        return ObserveResult.of(Fragment.plain(text), true);
      }
      return new ObserveResult(
          new Fragment(FragmentMode.MARKDOWN, text, images(path, text)),
          null,
          null,
          true,
          ObserveOptions.DEFAULT.withRelationsLink(true));
    }
    if (affordance == Affordance.PLAIN && isText(path)) {
      return ObserveResult.of(
          new BundlePlain(uri.child(Affordance.PLAIN), mimeType(path), read(path)), true);
    }
    if (affordance == Affordance.FILE && Files.isRegularFile(path)) {
      BasicFileAttributes attributes = attributes(path);
      return ObserveResult.of(
          new BundleFile(
              uri.child(Affordance.FILE),
              null,
              mimeType(path),
              attributes.size(),
              null,
              path.toUri().toString()),
          true);
    }
    throw new UnavailableException(
        "Local files cannot observe %s on %s".formatted(observable, file.relativePath()));
  }

  private List<ResourceUri> children(LocalFileLocator dir) {
    List<ResourceUri> children = new ArrayList<>();
    try (Stream<Path> entries = Files.list(toPath(dir))) {
      for (Path entry : entries.sorted().toList()) {
        String name = entry.getFileName().toString();
        if (name.startsWith(".")) continue;
        List<String> childPath = new ArrayList<>(dir.path());
        childPath.add(name);
        try {
          children.add(ResourceUri.of(realm, volume, childPath));
        } catch (UriFormatException e) {
          log.debug("Skipping '{}': name is not addressable ({})", entry, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new UnavailableException(
          "Unable to list directory " + dir.relativePath(), Map.of("error", e.getMessage()));
    }
    return children;
  }

  /** Loads images referenced with a relative path next to the markdown file. */
  private Map<String, FragmentBlob> images(Path markdown, String text) {
    Map<String, FragmentBlob> blobs = new LinkedHashMap<>();
    Matcher m = IMAGE_REF.matcher(text);
    while (m.find()) {
      String ref = m.group(1);
      if (ref.contains(":") || blobs.containsKey(ref)) continue;
      Path image = markdown.getParent().resolve(ref).normalize();
      try {
        if (!image.startsWith(root)
            || !Files.isRegularFile(image)
            || Files.size(image) > MAX_IMAGE_BYTES) {
          continue;
        }
        blobs.put(ref, FragmentBlob.of(mimeType(image), Files.readAllBytes(image)));
      } catch (IOException e) {
        log.warn("Unable to read image {} referenced from {}", image, markdown, e);
      }
    }
    return blobs;
  }

  private Path toPath(LocalFileLocator locator) {
    Path path = root.resolve(locator.relativePath()).normalize();
    if (!path.startsWith(root)) {
      throw new NotFoundException("Path escapes the connector root: " + locator.relativePath());
    }
    return path;
  }

  private static BasicFileAttributes attributes(Path path) {
    try {
      return Files.readAttributes(path, BasicFileAttributes.class);
    } catch (IOException e) {
      throw new NotFoundException("Unable to read attributes of " + path.getFileName(), e);
    }
  }

  private static String read(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IngestionException("Unable to read " + path.getFileName(), e);
    }
  }

  private static String extension(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static boolean isMarkdown(Path path) {
    return "text/markdown".equals(MIME_TYPES.get(extension(path)));
  }

  private static boolean isText(Path path) {
    return Files.isRegularFile(path) && (isMarkdown(path) || "txt".equals(extension(path)));
  }

  static String mimeType(Path path) {
    return MIME_TYPES.getOrDefault(extension(path), "application/octet-stream");
  }

  private static LocalFileLocator cast(Locator locator) {
    if (locator instanceof LocalFileLocator file) {
      return file;
    }
    throw new UnavailableException("Unsupported locator for local files: " + locator);
  }
}
