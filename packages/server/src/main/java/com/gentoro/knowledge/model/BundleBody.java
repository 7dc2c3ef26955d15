package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.AffordanceUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Chunked document: ordered sections and chunks plus extracted media. A document that fits in one
 * chunk has a single chunk addressed {@code $chunk}; its text is the body itself and the table of
 * contents is empty.
 */
public record BundleBody(
    AffordanceUri uri,
    String description,
    String mimeType,
    List<BodySection> sections,
    List<BodyChunk> chunks,
    List<BodyMedia> media)
    implements Bundle {

  public BundleBody {
    sections = sections == null ? List.of() : List.copyOf(sections);
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    media = media == null ? List.of() : List.copyOf(media);
  }

  public static BundleBody single(
      ResourceUri resource, String mimeType, String text, int numTokens, List<BodyMedia> media) {
    BodyChunk chunk =
        new BodyChunk(
            resource.childObservable(Observable.chunk(List.of())),
            ChunkDescriptions.summarize(text),
            numTokens,
            text);
    return new BundleBody(
        resource.child(Affordance.BODY), null, mimeType, List.of(), List.of(chunk), sorted(media));
  }

  /** Multi-chunk body; chunks are kept in document order, sections are ordered by indexes. */
  public static BundleBody chunked(
      ResourceUri resource,
      String mimeType,
      List<BodySection> sections,
      List<BodyChunk> chunks,
      List<BodyMedia> media) {
    List<BodySection> orderedSections = new ArrayList<>(sections);
    orderedSections.sort((a, b) -> compareIndexes(a.indexes(), b.indexes()));
    return new BundleBody(
        resource.child(Affordance.BODY), null, mimeType, orderedSections, chunks, sorted(media));
  }

  @JsonIgnore
  public boolean isSingleChunk() {
    return chunks.size() == 1 && chunks.get(0).uri().suffix().path().isEmpty();
  }

  public BundleBody withDescription(String description) {
    return new BundleBody(uri, description, mimeType, sections, chunks, media);
  }

  /** Full text of the body: the chunks concatenated in order. */
  public String render() {
    StringBuilder sb = new StringBuilder();
    for (BodyChunk chunk : chunks) {
      if (sb.length() > 0) sb.append("\n\n");
      sb.append(chunk.text());
    }
    return sb.toString();
  }

  public BodyChunk findChunk(Observable suffix) {
    for (BodyChunk chunk : chunks) {
      if (chunk.uri().suffix().equals(suffix)) return chunk;
    }
    return null;
  }

  public BodyMedia findMedia(Observable suffix) {
    for (BodyMedia m : media) {
      if (m.uri().suffix().equals(suffix)) return m;
    }
    return null;
  }

  /**
   * What a reader sees when observing {@code $body}: the text itself for a single-chunk body,
   * otherwise an index of sections and chunks.
   */
  public String bodyObservation() {
    if (isSingleChunk()) {
      return chunks.get(0).text();
    }
    StringBuilder sb = new StringBuilder();
    int s = 0;
    for (BodyChunk chunk : chunks) {
      List<Integer> indexes = chunk.uri().suffix().chunkIndexes();
      while (s < sections.size() && startsWith(indexes, sections.get(s).indexes())) {
        BodySection section = sections.get(s++);
        sb.append("  ".repeat(section.indexes().size() - 1))
            .append("- ")
            .append(section.heading())
            .append('\n');
      }
      sb.append("  ".repeat(Math.max(0, indexes.size() - 1)))
          .append("- ")
          .append(chunk.uri().suffix())
          .append(" (")
          .append(chunk.numTokens())
          .append(" tokens)");
      if (chunk.description() != null) {
        sb.append(": ").append(chunk.description());
      }
      sb.append('\n');
    }
    for (BodyMedia m : media) {
      sb.append("- ").append(m.uri().suffix());
      if (m.description() != null) {
        sb.append(": ").append(m.description());
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static boolean startsWith(List<Integer> indexes, List<Integer> prefix) {
    return indexes.size() >= prefix.size() && indexes.subList(0, prefix.size()).equals(prefix);
  }

  @Override
  public List<ObservationInfo> tableOfContents() {
    if (isSingleChunk()) {
      return List.of();
    }
    List<ObservationInfo> toc = new ArrayList<>(chunks.size() + media.size());
    for (BodyChunk chunk : chunks) {
      toc.add(new ObservationInfo(chunk.uri().suffix(), chunk.description(), chunk.numTokens()));
    }
    for (BodyMedia m : media) {
      toc.add(new ObservationInfo(m.uri().suffix(), m.description(), null));
    }
    return toc;
  }

  private static List<BodyMedia> sorted(List<BodyMedia> media) {
    List<BodyMedia> ordered = new ArrayList<>(media == null ? List.of() : media);
    ordered.sort(Comparator.comparing(m -> m.uri().toString()));
    return ordered;
  }

  static int compareIndexes(List<Integer> a, List<Integer> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int c = Integer.compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }

}
