package com.gentoro.knowledge.connector.files;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;

/** A file or directory below the connector root: {@code ndk://{realm}/{volume}/{path...}}. */
@JsonTypeName("local_file")
public record LocalFileLocator(String realm, String volume, List<String> path) implements Locator {
  public LocalFileLocator {
    path = List.copyOf(path);
  }

  @Override
  public ResourceUri resourceUri() {
    return ResourceUri.of(realm, volume, path);
  }

  /** Path relative to the connector root, {@code /}-separated. */
  public String relativePath() {
    return String.join("/", path);
  }
}
