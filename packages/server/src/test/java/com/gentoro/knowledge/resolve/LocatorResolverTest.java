package com.gentoro.knowledge.resolve;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.knowledge.connector.Connector;
import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ConnectorRegistry;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.storage.BundleStore;
import com.gentoro.knowledge.storage.InMemoryObjectStorage;
import com.gentoro.knowledge.storage.StorageKeys;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Reference;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LocatorResolver")
class LocatorResolverTest {

  private static final DocLocator LOCATOR = new DocLocator("test", "guide");
  private static final ExternalUri URL = ExternalUri.parse("https://docs.example.com/guide");

  @Mock private Connector connector;

  private InMemoryObjectStorage storage;
  private LocatorResolver resolver;

  @BeforeEach
  void setUp() {
    when(connector.realm()).thenReturn("test");
    storage = new InMemoryObjectStorage();
    BundleStore store = new BundleStore(storage, new StorageKeys("v1"), List.of(DocLocator.class));
    resolver =
        new LocatorResolver(ConnectorRegistry.builder().register(connector).build(), store);
  }

  private static ConnectorContext newContext() {
    return new ConnectorContext(Map.of(), name -> null);
  }

  @Test
  @DisplayName("An external URL is saved as a single alias and reused by later requests")
  void aliasIsIdempotent() {
    when(connector.locate(eq(URL), any())).thenReturn(LOCATOR);

    assertEquals(LOCATOR, resolver.infer(URL, newContext()));
    assertEquals(LOCATOR, resolver.infer(ExternalUri.parse("https://DOCS.example.com/guide/"), newContext()));
    assertEquals(LOCATOR, resolver.infer(URL, newContext()));

    assertEquals(1, storage.list("v1/alias/").size());
    verify(connector, times(1)).locate(eq(URL), any());
  }

  @Test
  @DisplayName("Lookups are memoized within one request")
  void memoizedPerRequest() {
    KnowledgeUri uri = KnowledgeUri.parse("ndk://test/docs/guide/$body");
    when(connector.locate(eq(uri.resourceUri()), any())).thenReturn(LOCATOR);
    ConnectorContext context = newContext();

    resolver.infer(uri, context);
    resolver.infer(uri.resourceUri(), context);

    verify(connector, times(1)).locate(any(), any());
    assertEquals(List.of(), storage.list("v1/alias/"), "Knowledge URIs never create aliases");
  }

  @Test
  @DisplayName("tryResolve returns null for links no connector recognizes")
  void tryResolveUnknown() {
    when(connector.locate(any(), any())).thenReturn(null);

    assertNull(resolver.tryResolve(URL, newContext()));
  }

  @Test
  @DisplayName("infer fails with NotFound for unrecognized references")
  void inferUnknown() {
    when(connector.locate(any(), any())).thenReturn(null);

    assertThrows(
        NotFoundException.class,
        () -> resolver.infer(Reference.parse("https://unknown.example.org/x"), newContext()));
  }
}
