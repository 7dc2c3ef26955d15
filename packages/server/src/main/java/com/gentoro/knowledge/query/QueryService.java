package com.gentoro.knowledge.query;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.exception.CancelledException;
import com.gentoro.knowledge.exception.ExceptionUtil;
import com.gentoro.knowledge.exception.KnowledgeException;
import com.gentoro.knowledge.exception.NetworkException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.BundleBody;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.Observation;
import com.gentoro.knowledge.model.ObservationError;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.resolve.LoadMode;
import com.gentoro.knowledge.resolve.LocatorResolver;
import com.gentoro.knowledge.resolve.Resolution;
import com.gentoro.knowledge.resolve.ResolutionEngine;
import com.gentoro.knowledge.storage.BundleStore;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.Reference;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Executes query batches.
 *
 * <p>Locators are inferred first, then attachments are written one after the other, then reads run
 * in parallel. Each connector has its own pool, sized by {@link Connector#maxConcurrency()}, so a
 * slow external system cannot starve the others. Within a request every resource is resolved at
 * most once; actions on the same resource are merged. Relations are followed breadth-first up to
 * the requested depth; failures while expanding are dropped.
 */
public class QueryService implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(QueryService.class);

  public static final long DEFAULT_TIMEOUT_SECONDS = 120;

  private final LocatorResolver locators;
  private final ResolutionEngine engine;
  private final BundleStore store;
  private final Function<String, String> environment;
  private final long timeoutSeconds;
  private final Map<String, ExecutorService> pools = new LinkedHashMap<>();

  public QueryService(
      ConnectorRegistry registry,
      LocatorResolver locators,
      ResolutionEngine engine,
      BundleStore store,
      Function<String, String> environment,
      long timeoutSeconds) {
    this.locators = locators;
    this.engine = engine;
    this.store = store;
    this.environment = environment;
    this.timeoutSeconds = timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    for (Connector connector : registry.connectors()) {
      pools.put(connector.realm(), newPool(connector.realm(), connector.maxConcurrency()));
    }
  }

  /**
   * @param credentials per-realm {@code Authorization} header values supplied by the caller
   */
  public QueryResponse execute(QueryRequest request, Map<String, String> credentials) {
    return execute(request, new ConnectorContext(credentials, environment));
  }

  public QueryResponse execute(QueryRequest request, ConnectorContext context) {
    Batch batch = new Batch();

    // Locators first: unresolvable references are reported and skipped.
    List<Target> targets = new ArrayList<>();
    for (QueryAction action : request.actions()) {
      try {
        Reference reference = Reference.parse(action.uri());
        Locator locator = locators.infer(reference, context);
        Observable suffix = reference instanceof KnowledgeUri uri ? uri.suffix() : null;
        targets.add(new Target(action, locator, suffix, affordances(action, suffix)));
      } catch (CancelledException e) {
        throw e;
      } catch (RuntimeException e) {
        log.debug("Cannot serve {}: {}", action.uri(), e.getMessage());
        batch.errors.add(new QueryError(action.uri(), ExceptionUtil.toErrorDetails(e)));
      }
    }

    for (Target target : targets) {
      if (target.action().method() != QueryMethod.ATTACHMENT) continue;
      QueryAction action = target.action();
      try {
        batch.resolutions.put(
            target.uri(),
            engine.attach(
                target.locator(),
                action.name(),
                action.mimeType(),
                action.description(),
                action.text(),
                context));
      } catch (CancelledException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn("Failed to attach '{}' to {}: {}", action.name(), target.uri(), e.getMessage());
        batch.errors.add(new QueryError(action.uri(), ExceptionUtil.toErrorDetails(e)));
      }
    }

    Map<ResourceUri, Read> wave = new LinkedHashMap<>();
    for (Target target : targets) {
      if (target.action().method() == QueryMethod.ATTACHMENT) continue;
      QueryAction action = target.action();
      wave.merge(
          target.uri(),
          new Read(
              target.locator(),
              action.loadMode(),
              target.affordances(),
              action.expandDepth(),
              action.expandMode(),
              true),
          Read::merge);
    }

    Set<ResourceUri> done = new HashSet<>();
    while (!wave.isEmpty()) {
      done.addAll(wave.keySet());
      wave = runWave(wave, done, batch, context);
    }

    for (Target target : targets) {
      if (target.action().method() != QueryMethod.ATTACHMENT) {
        collectObservations(target, batch);
      }
    }

    List<ResourceView> resources = new ArrayList<>();
    for (Resolution resolution : batch.resolutions.values()) {
      resources.add(resolution.view());
    }
    return new QueryResponse(
        resources,
        new ArrayList<>(batch.observations.values()),
        new ArrayList<>(batch.relations.values()),
        batch.errors);
  }

  /** Resolves one wave of resources in parallel and returns the next one. */
  private Map<ResourceUri, Read> runWave(
      Map<ResourceUri, Read> wave, Set<ResourceUri> done, Batch batch, ConnectorContext context) {
    Map<ResourceUri, Future<Resolution>> futures = new LinkedHashMap<>();
    for (Map.Entry<ResourceUri, Read> entry : wave.entrySet()) {
      futures.put(entry.getKey(), submit(entry.getValue(), context));
    }

    Map<ResourceUri, Read> next = new LinkedHashMap<>();
    for (Map.Entry<ResourceUri, Future<Resolution>> entry : futures.entrySet()) {
      ResourceUri uri = entry.getKey();
      Read read = wave.get(uri);
      Resolution resolution;
      try {
        resolution = await(uri, entry.getValue(), context);
      } catch (CancelledException e) {
        context.cancel();
        for (Future<Resolution> future : futures.values()) {
          future.cancel(true);
        }
        throw e;
      } catch (KnowledgeException e) {
        if (read.requested()) {
          batch.errors.add(new QueryError(uri.toString(), ExceptionUtil.toErrorDetails(e)));
        } else {
          log.debug("Dropping related resource {}: {}", uri, e.getMessage());
        }
        continue;
      }
      batch.resolutions.put(uri, resolution);
      if (read.expandDepth() > 0) {
        expand(resolution, read, done, next, batch, context);
      }
    }
    return next;
  }

  private void expand(
      Resolution resolution,
      Read read,
      Set<ResourceUri> done,
      Map<ResourceUri, Read> next,
      Batch batch,
      ConnectorContext context) {
    ResourceUri origin = resolution.uri();
    for (Relation relation : store.listRelations(origin)) {
      Map<ResourceUri, Locator> related = new LinkedHashMap<>();
      try {
        for (ResourceUri node : relation.nodes()) {
          if (!node.equals(origin)) related.put(node, locators.infer(node, context));
        }
      } catch (CancelledException e) {
        throw e;
      } catch (KnowledgeException e) {
        log.debug("Skipping relation {} of {}: {}", relation.uniqueId(), origin, e.getMessage());
        continue;
      }
      batch.relations.putIfAbsent(relation.uniqueId(), relation);
      for (Locator locator : related.values()) {
        ResourceUri uri = locator.resourceUri();
        if (done.contains(uri)) continue;
        next.merge(
            uri,
            new Read(
                locator,
                read.expandMode(),
                Set.of(),
                read.expandDepth() - 1,
                read.expandMode(),
                false),
            Read::merge);
      }
    }
  }

  private Future<Resolution> submit(Read read, ConnectorContext context) {
    ExecutorService pool = pools.get(read.locator().realm());
    if (pool == null) {
      return CompletableFuture.failedFuture(
          new NotFoundException(
              "No connector registered for realm '%s'".formatted(read.locator().realm())));
    }
    try {
      return pool.submit(
          () -> engine.resolve(read.locator(), read.mode(), read.affordances(), context));
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new CancelledException("The query service is shutting down", e));
    }
  }

  private Resolution await(ResourceUri uri, Future<Resolution> future, ConnectorContext context) {
    try {
      return future.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      throw ExceptionUtil.toKnowledgeException(e);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new NetworkException(
          "Resolution of %s timed out after %ds".formatted(uri, timeoutSeconds), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.cancel();
      throw new CancelledException("The request was interrupted", e);
    }
  }

  private void collectObservations(Target target, Batch batch) {
    Resolution resolution = batch.resolutions.get(target.uri());
    if (resolution == null) return;
    if (target.action().method() == QueryMethod.LOAD) {
      resolution.bundles().forEach(batch::add);
      resolution.errors().forEach(batch::add);
      return;
    }
    Affordance affordance = target.suffix().affordance();
    Bundle bundle = resolution.bundle(affordance);
    if (bundle != null) {
      batch.add(pick(bundle, target.suffix()));
      return;
    }
    for (ObservationError error : resolution.errors()) {
      if (error.uri().suffix().affordance() == affordance) batch.add(error);
    }
  }

  /** The chunk or media item named by {@code suffix}, or the bundle itself. */
  private static Observation pick(Bundle bundle, Observable suffix) {
    if (suffix.isAffordance() || !(bundle instanceof BundleBody body)) {
      return bundle;
    }
    Observation found =
        switch (suffix.kind()) {
          case CHUNK -> body.findChunk(suffix);
          case MEDIA -> body.findMedia(suffix);
          default -> bundle;
        };
    if (found != null) {
      return found;
    }
    KnowledgeUri uri = bundle.uri().resourceUri().child(suffix);
    return new ObservationError(
        uri, ExceptionUtil.toErrorDetails(new NotFoundException("Observation not found: " + uri)));
  }

  private static Set<Affordance> affordances(QueryAction action, Observable suffix) {
    Set<Affordance> affordances = EnumSet.noneOf(Affordance.class);
    switch (action.method()) {
      case LOAD -> {
        for (String observable : action.observe()) {
          affordances.add(Observable.parse(observable).affordance());
        }
      }
      case OBSERVE -> {
        if (suffix == null) {
          throw new ValidationException(
              "resources/observe needs an affordance or observable URI: " + action.uri());
        }
        affordances.add(suffix.affordance());
      }
      case ATTACHMENT -> {}
      default -> throw new IllegalStateException("Unsupported method: " + action.method());
    }
    return affordances;
  }

  private static ExecutorService newPool(String realm, int maxConcurrency) {
    int size = Math.max(1, maxConcurrency);
    AtomicInteger counter = new AtomicInteger();
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            size,
            size,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "knowledge-" + realm + "-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    pool.allowCoreThreadTimeOut(true);
    return pool;
  }

  @Override
  public void close() {
    for (Map.Entry<String, ExecutorService> entry : pools.entrySet()) {
      ExecutorService pool = entry.getValue();
      pool.shutdown();
      try {
        if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Pool of realm '{}' did not terminate in time", entry.getKey());
          pool.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        pool.shutdownNow();
      }
    }
  }

  private record Target(
      QueryAction action, Locator locator, Observable suffix, Set<Affordance> affordances) {
    ResourceUri uri() {
      return locator.resourceUri();
    }
  }

  /** A pending resolution; actions on the same resource merge into the strongest request. */
  private record Read(
      Locator locator,
      LoadMode mode,
      Set<Affordance> affordances,
      int expandDepth,
      LoadMode expandMode,
      boolean requested) {

    Read merge(Read other) {
      Set<Affordance> union = EnumSet.noneOf(Affordance.class);
      union.addAll(affordances);
      union.addAll(other.affordances);
      return new Read(
          locator,
          stronger(mode, other.mode),
          union,
          Math.max(expandDepth, other.expandDepth),
          stronger(expandMode, other.expandMode),
          requested || other.requested);
    }

    private static LoadMode stronger(LoadMode a, LoadMode b) {
      return rank(a) >= rank(b) ? a : b;
    }

    private static int rank(LoadMode mode) {
      return switch (mode) {
        case NONE -> 0;
        case AUTO -> 1;
        case FORCE -> 2;
      };
    }
  }

  private static final class Batch {
    final Map<ResourceUri, Resolution> resolutions = new LinkedHashMap<>();
    final Map<String, Observation> observations = new LinkedHashMap<>();
    final Map<String, Relation> relations = new TreeMap<>();
    final List<QueryError> errors = new ArrayList<>();

    void add(Observation observation) {
      observations.putIfAbsent(observation.uri().toString(), observation);
    }
  }
}
