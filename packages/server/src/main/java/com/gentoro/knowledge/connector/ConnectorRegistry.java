package com.gentoro.knowledge.connector;

import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.Reference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered, immutable set of connectors, one per realm. */
public final class ConnectorRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(ConnectorRegistry.class);

  private final Map<String, Connector> connectors;

  private ConnectorRegistry(Map<String, Connector> connectors) {
    this.connectors = Collections.unmodifiableMap(new LinkedHashMap<>(connectors));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Asks each connector in registration order for a locator. The first non-null answer wins; an
   * exception from a connector ends the lookup.
   */
  public Locator locate(Reference reference, ConnectorContext context) {
    for (Connector connector : connectors.values()) {
      context.ensureActive();
      Locator locator = connector.locate(reference, context);
      if (locator != null) {
        log.trace("Reference {} claimed by realm '{}'", reference, connector.realm());
        return locator;
      }
    }
    throw new NotFoundException("No connector recognizes " + reference);
  }

  public Connector find(Locator locator) {
    Connector connector = connectors.get(locator.realm());
    if (connector == null) {
      throw new NotFoundException("No connector registered for realm '%s'".formatted(locator.realm()));
    }
    return connector;
  }

  public Connector get(String realm) {
    return connectors.get(realm);
  }

  public List<Connector> connectors() {
    return List.copyOf(connectors.values());
  }

  public List<Class<?>> locatorTypes() {
    List<Class<?>> types = new ArrayList<>();
    for (Connector connector : connectors.values()) {
      types.addAll(connector.locatorTypes());
    }
    return types;
  }

  public static final class Builder {
    private final Map<String, Connector> connectors = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(Connector connector) {
      if (connectors.containsKey(connector.realm())) {
        throw new ConfigException(
            "A connector is already registered for realm '%s'".formatted(connector.realm()));
      }
      connectors.put(connector.realm(), connector);
      return this;
    }

    public ConnectorRegistry build() {
      return new ConnectorRegistry(connectors);
    }
  }
}
