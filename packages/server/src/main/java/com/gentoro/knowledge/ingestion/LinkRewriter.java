package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.exception.UriFormatException;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Rewrites links to external pages that a connector recognizes into knowledge URIs. */
public class LinkRewriter {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(LinkRewriter.class);

  private final LinkResolver resolver;

  public LinkRewriter(LinkResolver resolver) {
    this.resolver = resolver;
  }

  public String rewrite(String text, ConnectorContext context) {
    Map<String, Optional<ResourceUri>> resolved = new HashMap<>();
    return MarkdownLinks.rewrite(
        text,
        link ->
            resolved
                .computeIfAbsent(link.href(), href -> resolve(href, context))
                .map(ResourceUri::toString)
                .orElse(null));
  }

  private Optional<ResourceUri> resolve(String href, ConnectorContext context) {
    if (!href.startsWith("http://") && !href.startsWith("https://")) {
      return Optional.empty();
    }
    ExternalUri url;
    try {
      url = ExternalUri.parse(href);
    } catch (UriFormatException e) {
      log.trace("Ignoring malformed link {}: {}", href, e.getMessage());
      return Optional.empty();
    }
    return Optional.ofNullable(resolver.tryResolve(url, context));
  }
}
