package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.model.BodyChunk;
import com.gentoro.knowledge.model.BodyMedia;
import com.gentoro.knowledge.model.BodySection;
import com.gentoro.knowledge.model.BundleBody;
import com.gentoro.knowledge.model.ChunkDescriptions;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a markdown body into addressable chunks.
 *
 * <p>Documents at or under the chunking threshold stay a single {@code $chunk}. Larger ones are
 * parsed with flexmark into parts: headings, code blocks, tables, HTML blocks and standalone
 * images are atomic, every other top-level block is a paragraph. Parts are arranged into a
 * hierarchy by heading level, packed into groups of at most {@code maxChunkTokens}, and emitted
 * as nested chunk addresses ({@code $chunk/01/00}) plus section headings. A part larger than the
 * budget is emitted on its own, never truncated.
 */
public class MarkdownChunker {
  /** Accounts for the {@code #} prefix and the newlines after a heading. */
  static final int BUFFER_HEADING = 3;
  /** Accounts for the newlines after a paragraph. */
  static final int BUFFER_PARAGRAPH = 1;

  private final Tokenizer tokenizer;
  private final int chunkingThreshold;
  private final int maxChunkTokens;
  private final Parser parser;

  public MarkdownChunker(Tokenizer tokenizer, int chunkingThreshold, int maxChunkTokens) {
    if (chunkingThreshold <= 0 || maxChunkTokens <= 0)
      throw new IllegalArgumentException("Invalid token sizes");
    this.tokenizer = tokenizer;
    this.chunkingThreshold = chunkingThreshold;
    this.maxChunkTokens = maxChunkTokens;
    MutableDataSet options = new MutableDataSet();
    options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
    this.parser = Parser.builder(options).build();
  }

  public BundleBody chunk(
      ResourceUri resource,
      String mimeType,
      String text,
      List<BodyMedia> media,
      boolean describe) {
    int totalTokens = tokenizer.count(text);
    if (totalTokens <= chunkingThreshold) {
      return BundleBody.single(resource, mimeType, text, totalTokens, media);
    }

    List<Part> parts = splitParts(text);
    Group root = optimize(makeHierarchy(null, parts));

    List<BodySection> sections = new ArrayList<>();
    List<BodyChunk> chunks = new ArrayList<>();
    toBody(resource, describe, sections, chunks, root, List.of(), 0);
    return BundleBody.chunked(resource, mimeType, sections, chunks, media);
  }

  // -- parts

  enum PartKind {
    HEADING,
    ATOMIC,
    EMBED,
    TEXT
  }

  record Part(PartKind kind, int level, String title, String raw, int numTokens) {}

  List<Part> splitParts(String text) {
    List<Part> parts = new ArrayList<>();
    Node node = parser.parse(text).getFirstChild();
    while (node != null) {
      String raw = node.getChars().toString().strip();
      if (!raw.isEmpty()) {
        parts.add(toPart(node, raw));
      }
      node = node.getNext();
    }
    return parts;
  }

  private Part toPart(Node node, String raw) {
    if (node instanceof Heading h) {
      String title = h.getText().toString().strip();
      return new Part(
          PartKind.HEADING, h.getLevel(), title, raw, tokenizer.count(title) + BUFFER_HEADING);
    }
    if (node instanceof FencedCodeBlock
        || node instanceof IndentedCodeBlock
        || node instanceof TableBlock
        || node instanceof HtmlBlock) {
      return new Part(PartKind.ATOMIC, 0, null, raw, tokenizer.count(raw) + BUFFER_PARAGRAPH);
    }
    if (isStandaloneImage(node)) {
      // Embeds do not count against the budget.
      return new Part(PartKind.EMBED, 0, null, raw, 0);
    }
    return new Part(PartKind.TEXT, 0, null, raw, tokenizer.count(raw) + BUFFER_PARAGRAPH);
  }

  private static boolean isStandaloneImage(Node node) {
    if (!(node instanceof Paragraph)) return false;
    Node child = node.getFirstChild();
    while (child != null && child.getChars().isBlank()) child = child.getNext();
    if (!(child instanceof Image)) return false;
    Node rest = child.getNext();
    while (rest != null) {
      if (!rest.getChars().isBlank()) return false;
      rest = rest.getNext();
    }
    return true;
  }

  // -- hierarchy

  /** Either sub-groups or parts, never both. */
  final class Group {
    final Part heading;
    final List<Group> groups;
    final List<Part> chunks;

    private Group(Part heading, List<Group> groups, List<Part> chunks) {
      this.heading = heading;
      this.groups = groups;
      this.chunks = chunks;
    }

    int numTokens() {
      int total = heading == null ? 0 : heading.numTokens();
      for (Group g : groups) total += g.numTokens();
      for (Part p : chunks) total += p.numTokens();
      return total;
    }

    List<Part> flatten(boolean omitHeading) {
      List<Part> flat = new ArrayList<>();
      if (heading != null && !omitHeading) flat.add(heading);
      for (Group g : groups) flat.addAll(g.flatten(false));
      flat.addAll(chunks);
      return flat;
    }

    boolean containsSection() {
      if (heading != null) return true;
      for (Group g : groups) {
        if (g.containsSection()) return true;
      }
      return false;
    }

    String render() {
      StringBuilder sb = new StringBuilder();
      for (Part p : flatten(false)) {
        if (sb.length() > 0) sb.append("\n\n");
        sb.append(p.raw());
      }
      return sb.toString();
    }
  }

  Group ofGroups(Part heading, List<Group> groups) {
    return new Group(heading, groups, List.of());
  }

  Group ofChunks(Part heading, List<Part> chunks) {
    return new Group(heading, List.of(), chunks);
  }

  /** Packs heading-free parts into groups of at most {@code maxChunkTokens}. */
  Group fromPartsBounded(Part heading, List<Part> parts) {
    int total = 0;
    for (Part p : parts) total += p.numTokens();
    if (total < maxChunkTokens) {
      return ofChunks(heading, parts);
    }
    List<Group> subgroups = new ArrayList<>();
    List<Part> partial = new ArrayList<>();
    int partialTokens = 0;
    for (Part part : parts) {
      if (partialTokens > 0 && partialTokens + part.numTokens() > maxChunkTokens) {
        subgroups.add(ofChunks(null, partial));
        partial = new ArrayList<>();
        partialTokens = 0;
      }
      partial.add(part);
      partialTokens += part.numTokens();
    }
    if (!partial.isEmpty()) {
      subgroups.add(ofChunks(null, partial));
    }
    return ofGroups(heading, subgroups);
  }

  /** One section per heading of the smallest level present, recursively. */
  Group makeHierarchy(Part heading, List<Part> parts) {
    int level = Integer.MAX_VALUE;
    for (Part p : parts) {
      if (p.kind() == PartKind.HEADING) level = Math.min(level, p.level());
    }
    if (level == Integer.MAX_VALUE) {
      return fromPartsBounded(heading, parts);
    }

    List<Group> children = new ArrayList<>();
    Part sectionHeading = null;
    List<Part> sectionParts = new ArrayList<>();
    for (Part part : parts) {
      if (part.kind() == PartKind.HEADING && part.level() == level) {
        flushSection(children, sectionHeading, sectionParts);
        sectionHeading = part;
        sectionParts = new ArrayList<>();
      } else {
        sectionParts.add(part);
      }
    }
    flushSection(children, sectionHeading, sectionParts);
    return ofGroups(heading, children);
  }

  private void flushSection(List<Group> children, Part heading, List<Part> parts) {
    if (!parts.isEmpty()) {
      children.add(makeHierarchy(heading, parts));
    } else if (heading != null) {
      children.add(ofChunks(heading, List.of()));
    }
  }

  // -- optimization

  /**
   * After optimization a group either fits the budget and holds all its content as parts, or is
   * larger and holds sub-groups.
   */
  Group optimize(Group group) {
    if (group.numTokens() <= maxChunkTokens) {
      return ofChunks(group.heading, group.flatten(true));
    }
    if (!group.chunks.isEmpty() || !group.containsSection()) {
      return group;
    }
    List<Group> optimized = new ArrayList<>();
    for (Group g : group.groups) optimized.add(optimize(g));
    return ofGroups(group.heading, packNeighbors(optimized));
  }

  /** Merges runs of small neighboring groups; large groups act as barriers. */
  List<Group> packNeighbors(List<Group> groups) {
    List<Group> result = new ArrayList<>();
    List<Group> pending = new ArrayList<>();
    int pendingTokens = 0;
    for (Group group : groups) {
      int tokens = group.numTokens();
      if (tokens > maxChunkTokens) {
        flushPending(result, pending);
        pending = new ArrayList<>();
        pendingTokens = 0;
        result.add(group);
      } else if (pendingTokens + tokens > maxChunkTokens) {
        flushPending(result, pending);
        pending = new ArrayList<>(List.of(group));
        pendingTokens = tokens;
      } else {
        pending.add(group);
        pendingTokens += tokens;
      }
    }
    flushPending(result, pending);
    return result;
  }

  private void flushPending(List<Group> result, List<Group> pending) {
    if (pending.isEmpty()) return;
    result.add(join(pending));
  }

  Group join(List<Group> groups) {
    if (groups.size() == 1) return groups.get(0);
    List<Part> parts = new ArrayList<>();
    for (Group g : groups) parts.addAll(g.flatten(false));
    return ofChunks(null, parts);
  }

  // -- output

  /** Emits the group and returns how many sibling indexes it used. */
  private int toBody(
      ResourceUri resource,
      boolean describe,
      List<BodySection> sections,
      List<BodyChunk> chunks,
      Group group,
      List<Integer> parentIndexes,
      int selfIndex) {
    if (!group.groups.isEmpty() && group.heading == null) {
      int used = 0;
      int childIndex = selfIndex;
      for (Group child : group.groups) {
        int n = toBody(resource, describe, sections, chunks, child, parentIndexes, childIndex);
        used += n;
        childIndex += n;
      }
      return used;
    }
    if (!group.groups.isEmpty()) {
      List<Integer> sectionIndexes = append(parentIndexes, selfIndex);
      int childIndex = 0;
      for (Group child : group.groups) {
        childIndex += toBody(resource, describe, sections, chunks, child, sectionIndexes, childIndex);
      }
      sections.add(new BodySection(sectionIndexes, group.heading.title()));
      return 1;
    }
    if (!group.chunks.isEmpty()) {
      String text = group.render();
      List<Integer> indexes = append(parentIndexes, selfIndex);
      chunks.add(
          new BodyChunk(
              resource.childObservable(Observable.chunk(indexes)),
              describe ? ChunkDescriptions.summarize(text) : null,
              tokenizer.count(text),
              text));
      return 1;
    }
    return 0;
  }

  private static List<Integer> append(List<Integer> indexes, int index) {
    List<Integer> out = new ArrayList<>(indexes);
    out.add(index);
    return out;
  }
}
