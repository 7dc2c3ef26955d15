package com.gentoro.knowledge.resolve;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservedDelta;
import com.gentoro.knowledge.model.ResourceView;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.Observable;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CachePolicy")
class CachePolicyTest {

  private static final DocLocator LOCATOR = new DocLocator("test", "a");
  private static final Observable BODY = Observable.of(Affordance.BODY);
  private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2024-03-01T00:00:00Z");

  private final CachePolicy policy = new CachePolicy();

  private static ResourceView cached(MetadataDelta metadata, List<Observable> expired) {
    ObservedDelta body = new ObservedDelta(BODY, "text/markdown", null, null, null, null);
    return new ResourceView(
        LOCATOR.resourceUri(), LOCATOR, metadata, expired, List.of(), List.of(body), T1);
  }

  private static MetadataDelta revision(String data) {
    return MetadataDelta.builder().revisionData(data).build();
  }

  @Test
  @DisplayName("Without a cached view the cache is absent")
  void absentCache() {
    CacheDecision decision = policy.decide(LoadMode.AUTO, null, ResolveResult.of(revision("r1"), true));

    assertEquals(CacheState.ABSENT, decision.state());
    assertTrue(decision.expired().isEmpty());
  }

  @Test
  @DisplayName("Connector expiries on an absent cache are kept in suffix order")
  void absentCacheKeepsConnectorExpiries() {
    Observable collection = Observable.of(Affordance.COLLECTION);
    ResolveResult resolved = new ResolveResult(revision("r1"), List.of(collection, BODY), true);

    CacheDecision decision = policy.decide(LoadMode.AUTO, null, resolved);
    CacheDecision forced = policy.decide(LoadMode.FORCE, null, resolved);

    assertEquals(CacheState.ABSENT, decision.state());
    assertEquals(List.of(BODY, collection), decision.expired());
    assertEquals(decision.expired(), forced.expired());
    assertTrue(decision.metadataChanged());
  }

  @Test
  @DisplayName("Same data revision keeps the cache valid")
  void sameRevisionIsValid() {
    CacheDecision decision =
        policy.decide(
            LoadMode.AUTO, cached(revision("r1"), List.of()), ResolveResult.of(revision("r1"), true));

    assertEquals(CacheState.VALID, decision.state());
    assertFalse(decision.isExpired(BODY));
  }

  @Test
  @DisplayName("A new data revision expires every observed affordance")
  void newRevisionIsStale() {
    CacheDecision decision =
        policy.decide(
            LoadMode.AUTO, cached(revision("r1"), List.of()), ResolveResult.of(revision("r2"), true));

    assertEquals(CacheState.STALE, decision.state());
    assertTrue(decision.isExpired(BODY));
  }

  @Test
  @DisplayName("Force mode expires everything regardless of revisions")
  void forceIsAlwaysStale() {
    CacheDecision decision =
        policy.decide(
            LoadMode.FORCE, cached(revision("r1"), List.of()), ResolveResult.of(revision("r1"), true));

    assertEquals(CacheState.STALE, decision.state());
    assertTrue(decision.isExpired(BODY));
    assertTrue(decision.metadataChanged());
  }

  @Test
  @DisplayName("None mode trusts the cache without a resolve result")
  void noneTrustsCache() {
    CacheDecision decision = policy.decide(LoadMode.NONE, cached(revision("r1"), List.of()), null);

    assertEquals(CacheState.VALID, decision.state());
  }

  @Test
  @DisplayName("Expiries reported by the connector are honoured even with the same revision")
  void connectorExpiries() {
    ResolveResult resolved = new ResolveResult(revision("r1"), List.of(BODY), true);

    CacheDecision decision =
        policy.decide(LoadMode.AUTO, cached(revision("r1"), List.of()), resolved);

    assertEquals(CacheState.STALE, decision.state());
    assertEquals(List.of(BODY), decision.expired());
  }

  @Test
  @DisplayName("Updated timestamps are compared when no data revision exists")
  void comparesTimestamps() {
    MetadataDelta old = MetadataDelta.builder().updatedAt(T1).build();

    assertFalse(CachePolicy.isStale(old, MetadataDelta.builder().updatedAt(T1).build()));
    assertTrue(CachePolicy.isStale(old, MetadataDelta.builder().updatedAt(T2).build()));
    assertTrue(CachePolicy.isStale(old, MetadataDelta.EMPTY), "Missing tags count as stale");
    assertTrue(CachePolicy.isStale(revision("r1"), old), "Revision on one side only is stale");
  }

  @Test
  @DisplayName("A moved metadata revision is reported without expiring content")
  void metadataRevision() {
    MetadataDelta before = MetadataDelta.builder().revisionData("r1").revisionMeta("m1").build();
    MetadataDelta after = MetadataDelta.builder().revisionData("r1").revisionMeta("m2").build();

    CacheDecision decision =
        policy.decide(LoadMode.AUTO, cached(before, List.of()), ResolveResult.of(after, true));

    assertEquals(CacheState.VALID, decision.state());
    assertTrue(decision.metadataChanged());
  }
}
