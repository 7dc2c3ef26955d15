package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.exception.IngestionException;
import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.BundleBody;
import com.gentoro.knowledge.model.ChunkDescriptions;
import com.gentoro.knowledge.model.Fragment;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.model.ObservedDelta;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;

/**
 * Turns the raw output of {@code observe()} into a stored bundle.
 *
 * <ul>
 *   <li>{@code plain} fragments are kept verbatim, shortened past the fragment threshold;
 *   <li>{@code data} fragments are shortened and their links rewritten;
 *   <li>{@code markdown} fragments go through media extraction and link rewriting, then chunking
 *       when the result may be cached. Content that will not be cached is shortened instead.
 * </ul>
 *
 * Pre-built bundles are passed through. Relations are derived last, from the final bundle.
 */
public class IngestionPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(IngestionPipeline.class);

  private final Tokenizer tokenizer;
  private final MarkdownChunker chunker;
  private final TextShortener shortener;
  private final MediaExtractor mediaExtractor;
  private final LinkRewriter linkRewriter;
  private final RelationExtractor relationExtractor;
  private final int fragmentThresholdTokens;
  private final int fragmentTrimmedTokens;

  public IngestionPipeline(
      Tokenizer tokenizer,
      MarkdownChunker chunker,
      LinkResolver linkResolver,
      int fragmentThresholdTokens,
      int fragmentTrimmedTokens) {
    this.tokenizer = tokenizer;
    this.chunker = chunker;
    this.shortener = new TextShortener(tokenizer);
    this.mediaExtractor = new MediaExtractor();
    this.linkRewriter = new LinkRewriter(linkResolver);
    this.relationExtractor = new RelationExtractor();
    this.fragmentThresholdTokens = fragmentThresholdTokens;
    this.fragmentTrimmedTokens = fragmentTrimmedTokens;
  }

  public IngestedResult ingest(
      ResourceUri resourceUri,
      MetadataDelta metadata,
      ObserveResult observeResult,
      ConnectorContext context) {
    MetadataDelta merged =
        (metadata == null ? MetadataDelta.EMPTY : metadata).withUpdate(observeResult.metadata());
    boolean describe = observeResult.options().fields();

    Bundle bundle;
    if (observeResult.content() instanceof Fragment fragment) {
      bundle =
          ingestFragment(resourceUri, merged, fragment, observeResult.shouldCache(), describe, context);
    } else if (observeResult.content() instanceof Bundle prebuilt) {
      if (!prebuilt.uri().resourceUri().equals(resourceUri)) {
        throw new IngestionException(
            "Bundle %s does not belong to %s".formatted(prebuilt.uri(), resourceUri));
      }
      bundle = prebuilt;
    } else {
      throw new IngestionException(
          "Unsupported observed content: " + observeResult.content().getClass().getName());
    }

    if (describe && bundle instanceof BundleBody body && body.description() == null) {
      String description =
          merged.description() != null
              ? merged.description()
              : ChunkDescriptions.summarize(body.render());
      bundle = body.withDescription(description);
      if (merged.description() == null && description != null) {
        merged = merged.withUpdate(MetadataDelta.builder().description(description).build());
      }
    }

    List<Relation> relations =
        relationExtractor.extract(bundle, observeResult.relations(), observeResult.options());
    ObservedDelta observed = ObservedDelta.of(bundle, relations);
    log.debug(
        "Ingested {} ({} observation(s), {} relation(s))",
        bundle.uri(),
        observed.observations().size(),
        relations.size());
    return new IngestedResult(bundle, observed, merged, relations, observeResult.shouldCache());
  }

  private BundleBody ingestFragment(
      ResourceUri resourceUri,
      MetadataDelta metadata,
      Fragment fragment,
      boolean shouldCache,
      boolean describe,
      ConnectorContext context) {
    switch (fragment.mode()) {
      case PLAIN -> {
        String text = shorten(fragment.text());
        return BundleBody.single(
            resourceUri, mimeType(metadata, "text/plain"), text, tokenizer.count(text), List.of());
      }
      case DATA -> {
        String text = linkRewriter.rewrite(shorten(fragment.text()), context);
        return BundleBody.single(
            resourceUri, mimeType(metadata, "text/plain"), text, tokenizer.count(text), List.of());
      }
      case MARKDOWN -> {
        String markdown = shouldCache ? fragment.text() : shorten(fragment.text());
        MediaExtractor.Result extracted =
            mediaExtractor.extract(resourceUri, markdown, fragment.blobs());
        String text = linkRewriter.rewrite(extracted.text(), context);
        String mimeType = mimeType(metadata, "text/markdown");
        if (!shouldCache) {
          return BundleBody.single(
              resourceUri, mimeType, text, tokenizer.count(text), extracted.media());
        }
        return chunker.chunk(resourceUri, mimeType, text, extracted.media(), describe);
      }
      default -> throw new IngestionException("Unsupported fragment mode: " + fragment.mode());
    }
  }

  private String shorten(String text) {
    return shortener.shorten(text, fragmentThresholdTokens, fragmentTrimmedTokens);
  }

  private static String mimeType(MetadataDelta metadata, String fallback) {
    return metadata.mimeType() != null ? metadata.mimeType() : fallback;
  }
}
