package com.gentoro.knowledge.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResourceHistory delta log")
class ResourceHistoryTest {

  record TestLocator(String realm, String id) implements Locator {
    @Override
    public ResourceUri resourceUri() {
      return ResourceUri.of(realm, "test", id);
    }
  }

  private static final TestLocator LOCATOR = new TestLocator("test", "doc-1");
  private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2024-02-01T00:00:00Z");

  private static ObservedDelta body(String description) {
    return new ObservedDelta(
        Observable.of(Affordance.BODY), "text/markdown", description, null, null, null);
  }

  private static ResourceDelta delta(
      Instant at, Locator locator, List<Observable> expired, MetadataDelta metadata,
      List<ObservedDelta> observed) {
    return new ResourceDelta(at, locator, expired, List.of(), metadata, observed);
  }

  @Test
  @DisplayName("The first delta must carry a locator")
  void firstDeltaNeedsLocator() {
    ResourceDelta first = delta(T1, null, List.of(), MetadataDelta.EMPTY, List.of());

    assertThrows(ValidationException.class, () -> ResourceHistory.create(first));
  }

  @Test
  @DisplayName("An update that changes nothing returns the same history")
  void unchangedUpdateIsNoop() {
    MetadataDelta metadata = MetadataDelta.builder().name("Doc").build();
    ResourceHistory history =
        ResourceHistory.create(delta(T1, LOCATOR, List.of(), metadata, List.of(body("d"))));

    ResourceHistory updated =
        history.update(delta(T2, LOCATOR, List.of(), metadata, List.of(body("d"))));

    assertSame(history, updated);
  }

  @Test
  @DisplayName("Later deltas record only the changed metadata fields")
  void recordsOnlyChangedFields() {
    MetadataDelta first = MetadataDelta.builder().name("Doc").description("old").build();
    ResourceHistory history =
        ResourceHistory.create(delta(T1, LOCATOR, List.of(), first, List.of()));

    ResourceHistory updated =
        history.update(
            delta(T2, LOCATOR, List.of(), first.toBuilder().description("new").build(), List.of()));

    assertEquals(2, updated.history().size());
    ResourceDelta appended = updated.history().get(1);
    assertNull(appended.locator(), "Unchanged locator should not be repeated");
    assertNull(appended.metadata().name());
    assertEquals("new", appended.metadata().description());
    assertEquals("Doc", updated.merged().metadata().name());
    assertEquals("new", updated.merged().metadata().description());
  }

  @Test
  @DisplayName("A new observation clears an earlier expiry")
  void observationClearsExpiry() {
    ResourceHistory history =
        ResourceHistory.create(
            delta(T1, LOCATOR, List.of(), MetadataDelta.EMPTY, List.of(body("v1"))));

    ResourceHistory expired =
        history.update(
            delta(T2, null, List.of(Observable.of(Affordance.BODY)), MetadataDelta.EMPTY,
                List.of()));
    assertTrue(expired.merged().isExpired(Affordance.BODY));
    assertTrue(expired.merged().needsObservation(Affordance.BODY));

    ResourceHistory refreshed =
        expired.update(delta(T2, null, List.of(), MetadataDelta.EMPTY, List.of(body("v1"))));
    assertFalse(refreshed.merged().isExpired(Affordance.BODY));
    assertEquals(3, refreshed.history().size(), "Re-observing an expired body must be recorded");
  }

  @Test
  @DisplayName("Labels are unique per name and target")
  void labelsOverwritePerKey() {
    Observable target = Observable.of(Affordance.BODY);
    ResourceHistory history =
        ResourceHistory.create(
            new ResourceDelta(
                T1, LOCATOR, List.of(), List.of(new Label("status", target, "draft")), null,
                null));

    ResourceHistory updated =
        history.update(
            new ResourceDelta(
                T2, null, List.of(), List.of(new Label("status", target, "final")), null, null));

    assertEquals(List.of(new Label("status", target, "final")), updated.allLabels());
  }

  @Test
  @DisplayName("allRelations combines metadata and observed relations without duplicates")
  void collectsRelations() {
    ResourceUri self = LOCATOR.resourceUri();
    ResourceUri other = ResourceUri.of("test", "test", "doc-2");
    Relation link = new RelationLink(self, other);
    Relation parent = new RelationParent(other, self);
    ObservedDelta observed =
        new ObservedDelta(
            Observable.of(Affordance.BODY), "text/markdown", null, null, null, List.of(link));
    ResourceHistory history =
        ResourceHistory.create(
            delta(
                T1, LOCATOR, List.of(),
                MetadataDelta.builder().relations(List.of(parent, link)).build(),
                List.of(observed)));

    assertEquals(List.of(parent, link), history.allRelations());
  }

  @Test
  @DisplayName("Metadata merge keeps absent fields and treats empty lists as present")
  void metadataMerge() {
    MetadataDelta base =
        MetadataDelta.builder().name("A").affordances(Affordance.BODY).description("x").build();
    MetadataDelta update = MetadataDelta.builder().affordances(List.of()).description("y").build();

    MetadataDelta merged = base.withUpdate(update);

    assertEquals("A", merged.name());
    assertEquals("y", merged.description());
    assertEquals(List.of(), merged.affordances());
    assertFalse(merged.supports(Affordance.BODY));
    assertTrue(base.diff(base).isEmpty());
  }
}
