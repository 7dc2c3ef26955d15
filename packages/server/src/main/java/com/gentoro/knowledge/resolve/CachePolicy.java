package com.gentoro.knowledge.resolve;

import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservedDelta;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Observable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides, per resource and request, whether cached content can be served.
 *
 * <p>Revision tags are compared in order of precedence: {@code revisionData}, then {@code
 * updatedAt}. {@code revisionMeta} only flags a metadata change. When no tag allows a comparison the
 * cache is considered stale.
 */
public class CachePolicy {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(CachePolicy.class);

  /**
   * @param cached the stored view, or {@code null}
   * @param resolved the fresh resolve result; ignored (and may be {@code null}) in {@code none} mode
   */
  public CacheDecision decide(LoadMode mode, ResourceView cached, ResolveResult resolved) {
    if (cached == null) {
      return new CacheDecision(CacheState.ABSENT, new ArrayList<>(expiredBy(resolved)), true);
    }

    Set<Observable> expired = new TreeSet<>(cached.expired());
    switch (mode) {
      case NONE -> {
        return new CacheDecision(CacheState.VALID, new ArrayList<>(expired), false);
      }
      case FORCE -> {
        expired.addAll(observedSuffixes(cached));
        expired.addAll(expiredBy(resolved));
        return new CacheDecision(CacheState.STALE, new ArrayList<>(expired), true);
      }
      case AUTO -> {
        MetadataDelta before = cached.metadata();
        MetadataDelta after = resolved.metadata();
        boolean stale = isStale(before, after);
        if (stale) {
          expired.addAll(observedSuffixes(cached));
        }
        expired.addAll(resolved.expired());
        boolean metadataChanged =
            after.revisionMeta() != null
                && !Objects.equals(before.revisionMeta(), after.revisionMeta());
        log.trace(
            "Cache of {} is {} ({} expired, metadata changed: {})",
            cached.uri(),
            stale ? "stale" : "valid",
            expired.size(),
            metadataChanged);
        return new CacheDecision(
            stale || !expired.isEmpty() ? CacheState.STALE : CacheState.VALID,
            new ArrayList<>(expired),
            metadataChanged);
      }
      default -> throw new IllegalStateException("Unsupported load mode: " + mode);
    }
  }

  static boolean isStale(MetadataDelta before, MetadataDelta after) {
    String oldRevision = before.revisionData();
    String newRevision = after.revisionData();
    if (oldRevision != null && newRevision != null) {
      return !oldRevision.equals(newRevision);
    }
    if (oldRevision != null || newRevision != null) {
      return true;
    }
    Instant oldUpdated = before.updatedAt();
    Instant newUpdated = after.updatedAt();
    if (oldUpdated == null || newUpdated == null) {
      return true;
    }
    return newUpdated.isAfter(oldUpdated);
  }

  private static Set<Observable> observedSuffixes(ResourceView cached) {
    Set<Observable> suffixes = new TreeSet<>();
    for (ObservedDelta observed : cached.observed()) {
      suffixes.add(observed.suffix());
    }
    return suffixes;
  }

  private static Set<Observable> expiredBy(ResolveResult resolved) {
    return resolved == null ? Set.of() : new TreeSet<>(resolved.expired());
  }
}
