package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;

/** Maps an external link to the resource it denotes, when some connector recognizes it. */
@FunctionalInterface
public interface LinkResolver {
  LinkResolver NONE = (url, context) -> null;

  /** The resource URI, or {@code null} when the link is not recognized. */
  ResourceUri tryResolve(ExternalUri url, ConnectorContext context);
}
