package com.gentoro.knowledge.resolve;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.exception.CancelledException;
import com.gentoro.knowledge.exception.ExceptionUtil;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.ingestion.IngestedResult;
import com.gentoro.knowledge.ingestion.IngestionPipeline;
import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.BundlePlain;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservationError;
import com.gentoro.knowledge.model.ObservedDelta;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.ResourceDelta;
import com.gentoro.knowledge.model.ResourceHistory;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.storage.AliasEntry;
import com.gentoro.knowledge.storage.BundleStore;
import com.gentoro.knowledge.storage.ResolutionCommit;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves one resource: reads the cached history, asks the connector for fresh metadata, decides
 * what the cache can still serve, observes and ingests the rest, and commits the outcome.
 *
 * <p>Connector failures during {@code resolve()} are terminal for the resource. Failures while
 * observing one affordance become {@link ObservationError}s and do not affect the others. The
 * engine never retries.
 */
public class ResolutionEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(ResolutionEngine.class);

  private final ConnectorRegistry registry;
  private final BundleStore store;
  private final IngestionPipeline pipeline;
  private final CachePolicy policy;
  private final Clock clock;

  public ResolutionEngine(
      ConnectorRegistry registry,
      BundleStore store,
      IngestionPipeline pipeline,
      CachePolicy policy,
      Clock clock) {
    this.registry = registry;
    this.store = store;
    this.pipeline = pipeline;
    this.policy = policy;
    this.clock = clock;
  }

  /**
   * @param observe affordances whose bundles the caller wants back. Refreshed {@code $body} and
   *     {@code $collection} bundles are returned as well.
   */
  public Resolution resolve(
      Locator locator, LoadMode mode, Collection<Affordance> observe, ConnectorContext context) {
    ResourceUri uri = locator.resourceUri();
    ResourceHistory history = store.loadHistory(uri);
    ResourceView cached = history == null ? null : history.merged();
    Set<Affordance> requested = sorted(observe);

    if (mode == LoadMode.NONE) {
      return fromCache(locator, history, requested);
    }

    Connector connector = registry.find(locator);
    context.ensureActive();
    ResolveResult resolved =
        context.memoize("resolve:" + uri, () -> connector.resolve(locator, cached, context));
    CacheDecision decision = policy.decide(mode, cached, resolved);
    MetadataDelta metadata =
        (cached == null ? MetadataDelta.EMPTY : cached.metadata()).withUpdate(resolved.metadata());
    log.debug("Resolved {} ({}, mode {})", uri, decision.state(), mode.value());

    // Serve from cache what is still valid.
    List<Bundle> bundles = new ArrayList<>();
    List<ObservationError> errors = new ArrayList<>();
    Set<Affordance> missing = new TreeSet<>();
    for (Affordance affordance : requested) {
      boolean expired = mode == LoadMode.FORCE || decision.isExpired(affordance.observable());
      Bundle bundle = expired ? null : store.loadBundle(uri, affordance);
      if (bundle != null) {
        bundles.add(bundle);
      } else if (metadata.supports(affordance)) {
        missing.add(affordance);
      } else if ((bundle = store.loadBundle(uri, affordance)) != null) {
        // Attachments stand in for affordances the connector cannot read.
        bundles.add(bundle);
      } else {
        errors.add(unsupported(uri, affordance));
      }
    }

    // Keep $body and $collection fresh so that descriptions and relations stay current.
    for (Affordance affordance : List.of(Affordance.BODY, Affordance.COLLECTION)) {
      if (metadata.supports(affordance)
          && (cached == null
              || cached.observedFor(affordance) == null
              || decision.isExpired(affordance.observable()))) {
        missing.add(affordance);
      }
    }

    // Observe and ingest.
    List<IngestedResult> ingested = new ArrayList<>();
    for (Affordance affordance : missing) {
      context.ensureActive();
      try {
        ObserveResult result =
            connector.observe(locator, affordance.observable(), metadata, context);
        IngestedResult ingestedResult = pipeline.ingest(uri, metadata, result, context);
        metadata = ingestedResult.metadata();
        ingested.add(ingestedResult);
        bundles.add(ingestedResult.bundle());
      } catch (CancelledException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn("Failed to observe {}{}: {}", uri, affordance, e.getMessage());
        log.debug("Observation failure", e);
        errors.add(
            new ObservationError(uri.child(affordance), ExceptionUtil.toErrorDetails(e)));
      }
    }

    Set<Observable> expired = new TreeSet<>(decision.expired());
    for (IngestedResult result : ingested) {
      expired.remove(result.bundle().uri().suffix());
    }
    List<ObservedDelta> observed = new ArrayList<>();
    for (IngestedResult result : ingested) {
      observed.add(result.observed());
    }
    ResourceDelta delta =
        new ResourceDelta(
            Instant.now(clock),
            locator,
            new ArrayList<>(expired),
            List.of(),
            metadata,
            observed);

    ResourceHistory updated = history == null ? ResourceHistory.create(delta) : history.update(delta);
    boolean shouldCache = resolved.shouldCache();
    for (IngestedResult result : ingested) {
      shouldCache |= result.shouldCache();
    }

    context.ensureActive();
    boolean committed = false;
    if (history != null || shouldCache) {
      List<Bundle> toSave = new ArrayList<>();
      for (IngestedResult result : ingested) {
        if (result.shouldCache()) toSave.add(result.bundle());
      }
      ResolutionCommit commit =
          diff(uri, locator, history, updated == history ? null : updated, updated, toSave);
      store.commit(commit);
      committed = !commit.isEmpty();
    } else {
      log.debug("Not caching {}: the connector disallowed it", uri);
    }

    bundles.sort((a, b) -> a.uri().suffix().compareTo(b.uri().suffix()));
    return new Resolution(locator, updated, decision, bundles, errors, committed);
  }

  /**
   * Records text supplied by the caller as the {@code $plain} bundle of a resource. The connector
   * content takes precedence: nothing is written when the resource already has a body or a plain
   * text observation of its own.
   */
  public Resolution attach(
      Locator locator,
      String name,
      String mimeType,
      String description,
      String text,
      ConnectorContext context) {
    ResourceUri uri = locator.resourceUri();
    ResourceHistory history = store.loadHistory(uri);
    ResourceView cached = history == null ? null : history.merged();
    if (cached != null
        && (cached.observedFor(Affordance.BODY) != null
            || cached.metadata().supports(Affordance.PLAIN))) {
      log.debug("Ignoring attachment for {}: the resource has content of its own", uri);
      return new Resolution(
          locator,
          history,
          new CacheDecision(CacheState.VALID, cached.expired(), false),
          List.of(),
          List.of(),
          false);
    }

    context.ensureActive();
    BundlePlain bundle = new BundlePlain(uri.child(Affordance.PLAIN), mimeType, text);
    MetadataDelta metadata =
        MetadataDelta.builder().name(name).mimeType(mimeType).description(description).build();
    ResourceDelta delta =
        new ResourceDelta(
            Instant.now(clock),
            locator,
            List.of(),
            List.of(),
            metadata,
            List.of(ObservedDelta.of(bundle, List.of())));
    ResourceHistory updated = history == null ? ResourceHistory.create(delta) : history.update(delta);
    store.commit(
        new ResolutionCommit(
            uri, updated, List.of(bundle), List.of(), List.of(), List.of(), List.of()));
    log.info("Attached '{}' to {}", name, uri);
    return new Resolution(
        locator,
        updated,
        new CacheDecision(cached == null ? CacheState.ABSENT : CacheState.STALE, List.of(), true),
        List.of(bundle),
        List.of(),
        true);
  }

  private Resolution fromCache(Locator locator, ResourceHistory history, Set<Affordance> requested) {
    ResourceUri uri = locator.resourceUri();
    if (history == null) {
      throw new NotFoundException("Resource is not cached: " + uri);
    }
    List<Bundle> bundles = new ArrayList<>();
    List<ObservationError> errors = new ArrayList<>();
    for (Affordance affordance : requested) {
      Bundle bundle = store.loadBundle(uri, affordance);
      if (bundle != null) {
        bundles.add(bundle);
      } else {
        errors.add(
            new ObservationError(
                uri.child(affordance),
                ExceptionUtil.toErrorDetails(
                    new NotFoundException("Observation is not cached: " + uri.child(affordance)))));
      }
    }
    CacheDecision decision = policy.decide(LoadMode.NONE, history.merged(), null);
    return new Resolution(locator, history, decision, bundles, errors, false);
  }

  /** Collects the bundles, alias and relation changes between two histories. */
  private ResolutionCommit diff(
      ResourceUri uri,
      Locator locator,
      ResourceHistory before,
      ResourceHistory toWrite,
      ResourceHistory after,
      List<Bundle> bundles) {
    Set<ExternalUri> oldAliases =
        before == null ? Set.of() : new LinkedHashSet<>(before.allAliases());
    Set<ExternalUri> newAliases = new LinkedHashSet<>(after.allAliases());
    List<AliasEntry> savedAliases = new ArrayList<>();
    for (ExternalUri alias : newAliases) {
      if (!oldAliases.contains(alias)) savedAliases.add(new AliasEntry(alias, uri, locator));
    }
    List<ExternalUri> removedAliases = new ArrayList<>();
    for (ExternalUri alias : oldAliases) {
      if (!newAliases.contains(alias)) removedAliases.add(alias);
    }

    Map<String, Relation> oldRelations = byId(before == null ? List.of() : before.allRelations());
    Map<String, Relation> newRelations = byId(after.allRelations());
    List<Relation> savedRelations = new ArrayList<>();
    for (Map.Entry<String, Relation> entry : newRelations.entrySet()) {
      if (!oldRelations.containsKey(entry.getKey())) savedRelations.add(entry.getValue());
    }
    List<Relation> removedRelations = new ArrayList<>();
    for (Map.Entry<String, Relation> entry : oldRelations.entrySet()) {
      if (!newRelations.containsKey(entry.getKey())) removedRelations.add(entry.getValue());
    }

    return new ResolutionCommit(
        uri, toWrite, bundles, savedRelations, removedRelations, savedAliases, removedAliases);
  }

  private static Map<String, Relation> byId(List<Relation> relations) {
    Map<String, Relation> map = new LinkedHashMap<>();
    for (Relation relation : relations) {
      map.putIfAbsent(relation.uniqueId(), relation);
    }
    return map;
  }

  private static Set<Affordance> sorted(Collection<Affordance> affordances) {
    Set<Affordance> set = EnumSet.noneOf(Affordance.class);
    if (affordances != null) set.addAll(affordances);
    return set;
  }

  private static ObservationError unsupported(ResourceUri uri, Affordance affordance) {
    return new ObservationError(
        uri.child(affordance),
        ExceptionUtil.toErrorDetails(
            new NotFoundException(
                "Affordance %s is not supported by %s".formatted(affordance, uri))));
  }
}
