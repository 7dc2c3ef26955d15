package com.gentoro.knowledge.connector;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.knowledge.connector.files.LocalFileLocator;
import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.exception.UnavailableException;
import com.gentoro.knowledge.uri.ExternalUri;
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
@DisplayName("ConnectorRegistry")
class ConnectorRegistryTest {

  private static final Reference URL = ExternalUri.parse("https://example.com/page");

  @Mock private Connector first;
  @Mock private Connector second;
  @Mock private Connector third;

  private ConnectorRegistry registry;
  private ConnectorContext context;

  @BeforeEach
  void setUp() {
    when(first.realm()).thenReturn("first");
    when(second.realm()).thenReturn("second");
    when(third.realm()).thenReturn("third");
    registry = ConnectorRegistry.builder().register(first).register(second).register(third).build();
    context = new ConnectorContext(Map.of(), name -> null);
  }

  @Test
  @DisplayName("The first connector that claims a reference wins and later ones are not asked")
  void firstClaimWins() {
    LocalFileLocator locator = new LocalFileLocator("second", "docs", List.of("page"));
    when(first.locate(URL, context)).thenReturn(null);
    when(second.locate(URL, context)).thenReturn(locator);

    assertEquals(locator, registry.locate(URL, context));
    verify(third, never()).locate(any(), any());
  }

  @Test
  @DisplayName("A connector that recognizes but refuses a reference stops the lookup")
  void refusalStopsLookup() {
    when(first.locate(URL, context)).thenThrow(new UnavailableException("Unsupported page"));

    assertThrows(UnavailableException.class, () -> registry.locate(URL, context));
    verify(second, never()).locate(any(), any());
  }

  @Test
  @DisplayName("An unclaimed reference is not found")
  void unclaimed() {
    when(first.locate(URL, context)).thenReturn(null);
    when(second.locate(URL, context)).thenReturn(null);
    when(third.locate(URL, context)).thenReturn(null);

    assertThrows(NotFoundException.class, () -> registry.locate(URL, context));
  }

  @Test
  @DisplayName("Connectors are found by the realm of a locator")
  void findByRealm() {
    assertSame(third, registry.find(new LocalFileLocator("third", "docs", List.of("a"))));
    assertThrows(
        NotFoundException.class,
        () -> registry.find(new LocalFileLocator("unknown", "docs", List.of("a"))));
  }

  @Test
  @DisplayName("Realms must be unique")
  void duplicateRealm() {
    assertThrows(
        ConfigException.class, () -> ConnectorRegistry.builder().register(first).register(first));
  }
}
