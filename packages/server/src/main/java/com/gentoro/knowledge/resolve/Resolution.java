package com.gentoro.knowledge.resolve;

import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.ObservationError;
import com.gentoro.knowledge.model.ResourceHistory;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;

/**
 * Result of resolving one resource within a request.
 *
 * @param history the history after this resolution, persisted or not
 * @param bundles requested or refreshed bundles, in affordance order
 * @param errors observations that failed
 * @param committed whether anything was written to the store
 */
public record Resolution(
    Locator locator,
    ResourceHistory history,
    CacheDecision decision,
    List<Bundle> bundles,
    List<ObservationError> errors,
    boolean committed) {

  public Resolution {
    bundles = bundles == null ? List.of() : List.copyOf(bundles);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public ResourceUri uri() {
    return locator.resourceUri();
  }

  public ResourceView view() {
    return history.merged();
  }

  public Bundle bundle(Affordance affordance) {
    for (Bundle bundle : bundles) {
      if (bundle.uri().affordance() == affordance) return bundle;
    }
    return null;
  }
}
