package com.gentoro.knowledge.connector;

import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.uri.Observable;
import java.util.List;

/**
 * Outcome of {@link Connector#resolve}.
 *
 * @param metadata new or changed metadata
 * @param expired observables to read again regardless of revision tags
 * @param shouldCache whether the resource history may be persisted
 */
public record ResolveResult(MetadataDelta metadata, List<Observable> expired, boolean shouldCache) {
  public ResolveResult {
    metadata = metadata == null ? MetadataDelta.EMPTY : metadata;
    expired = expired == null ? List.of() : List.copyOf(expired);
  }

  public static ResolveResult of(MetadataDelta metadata, boolean shouldCache) {
    return new ResolveResult(metadata, List.of(), shouldCache);
  }
}
