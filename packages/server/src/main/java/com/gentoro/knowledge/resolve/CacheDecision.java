package com.gentoro.knowledge.resolve;

import com.gentoro.knowledge.uri.Observable;
import java.util.List;

/**
 * Outcome of {@link CachePolicy#decide}.
 *
 * @param state how far the cache can be trusted
 * @param expired observables that must be read again before they are served
 * @param metadataChanged whether the metadata revision moved
 */
public record CacheDecision(CacheState state, List<Observable> expired, boolean metadataChanged) {
  public CacheDecision {
    expired = expired == null ? List.of() : List.copyOf(expired);
  }

  public boolean isExpired(Observable observable) {
    return expired.contains(observable);
  }
}
