package com.gentoro.knowledge.resolve;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.exception.CancelledException;
import com.gentoro.knowledge.exception.KnowledgeException;
import com.gentoro.knowledge.ingestion.LinkResolver;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.ResourceHistory;
import com.gentoro.knowledge.storage.AliasEntry;
import com.gentoro.knowledge.storage.BundleStore;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Reference;
import com.gentoro.knowledge.uri.ResourceUri;

/**
 * Infers the {@link Locator} of a reference: from the cached history of a knowledge URI, from the
 * stored alias of an external URI, or by asking the connectors. Results are memoized for the
 * duration of the request.
 */
public class LocatorResolver implements LinkResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(LocatorResolver.class);

  private final ConnectorRegistry registry;
  private final BundleStore store;

  public LocatorResolver(ConnectorRegistry registry, BundleStore store) {
    this.registry = registry;
    this.store = store;
  }

  /**
   * @throws com.gentoro.knowledge.exception.NotFoundException when no connector recognizes the
   *     reference, or the one that does cannot find it
   */
  public Locator infer(Reference reference, ConnectorContext context) {
    Reference key = reference instanceof KnowledgeUri uri ? uri.resourceUri() : reference;
    return context.memoize("locator:" + key, () -> lookup(key, context));
  }

  @Override
  public ResourceUri tryResolve(ExternalUri url, ConnectorContext context) {
    try {
      return infer(url, context).resourceUri();
    } catch (CancelledException e) {
      throw e;
    } catch (KnowledgeException e) {
      log.debug("Link {} is not resolvable: {}", url, e.getMessage());
      return null;
    }
  }

  private Locator lookup(Reference reference, ConnectorContext context) {
    if (reference instanceof ResourceUri uri) {
      ResourceHistory history = store.loadHistory(uri);
      if (history != null) {
        return history.locator();
      }
    } else if (reference instanceof ExternalUri url) {
      AliasEntry alias = store.loadAlias(url);
      if (alias != null) {
        log.trace("Alias hit for {}: {}", url, alias.resource());
        return alias.locator();
      }
    }

    Locator locator = registry.locate(reference, context);
    if (reference instanceof ExternalUri url && !store.hasHistory(locator.resourceUri())) {
      // Placeholder until the resource is loaded; the history then takes over.
      store.saveAlias(new AliasEntry(url, locator.resourceUri(), locator));
      log.debug("Saved alias {} -> {}", url, locator.resourceUri());
    }
    return locator;
  }
}
