package com.gentoro.knowledge.connector;

import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.Reference;
import java.util.List;

/**
 * Maps references of one realm onto an external system.
 *
 * <p>Implementations are stateless between requests; anything request-scoped (credentials,
 * memoized sub-fetches, cancellation) comes from the {@link ConnectorContext}.
 */
public interface Connector {

  String realm();

  /**
   * Claims a reference. Returns {@code null} when the reference belongs to another connector and
   * throws {@link com.gentoro.knowledge.exception.NotFoundException} (or {@link
   * com.gentoro.knowledge.exception.UnavailableException}) when it is recognized but cannot be
   * served, which stops the lookup.
   */
  Locator locate(Reference reference, ConnectorContext context);

  /** Fetches fresh metadata; {@code cached} is the stored view or {@code null}. */
  ResolveResult resolve(Locator locator, ResourceView cached, ConnectorContext context);

  /** Reads one affordance. {@code resolved} is the metadata merged with the resolve result. */
  ObserveResult observe(
      Locator locator, Observable observable, MetadataDelta resolved, ConnectorContext context);

  /** Locator classes to register for polymorphic storage. */
  List<Class<? extends Locator>> locatorTypes();

  /** Upper bound of concurrent calls issued to the external system. */
  default int maxConcurrency() {
    return 4;
  }
}
