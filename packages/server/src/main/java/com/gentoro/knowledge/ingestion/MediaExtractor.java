package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.model.BodyMedia;
import com.gentoro.knowledge.model.FragmentBlob;
import com.gentoro.knowledge.uri.ObservableUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the blobs of a markdown fragment into {@code $media/<name>} observables.
 *
 * <p>Blobs that are never referenced, referenced more than once, or whose data is shared with
 * another blob are discarded (thumbnails, letterheads). Only images are kept. References to kept
 * blobs are rewritten to the absolute media URI; references to discarded ones become anchors
 * {@code ](#name)} so that the file name stays visible.
 */
public class MediaExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(MediaExtractor.class);

  public record Result(String text, List<BodyMedia> media) {}

  public Result extract(ResourceUri resource, String text, Map<String, FragmentBlob> blobs) {
    if (blobs.isEmpty()) {
      return new Result(text, List.of());
    }

    Set<String> seenData = new HashSet<>();
    Set<String> repeatedData = new HashSet<>();
    for (FragmentBlob blob : blobs.values()) {
      if (!seenData.add(blob.data())) repeatedData.add(blob.data());
    }

    Map<String, String> names = assignNames(text, blobs.keySet());
    Map<String, String> alts = altTexts(text);
    List<BodyMedia> media = new ArrayList<>();
    String rewritten = text;
    for (Map.Entry<String, FragmentBlob> entry : blobs.entrySet()) {
      String ref = entry.getKey();
      FragmentBlob blob = entry.getValue();
      String name = names.get(ref);
      int occurrences = MarkdownLinks.countReferences(text, ref);
      boolean keep =
          occurrences == 1
              && !repeatedData.contains(blob.data())
              && blob.mimeType() != null
              && blob.mimeType().startsWith("image/");
      if (keep) {
        ObservableUri uri = resource.childObservable(Observable.media(List.of(name)));
        media.add(new BodyMedia(uri, null, alts.get(ref), blob.mimeType(), blob.data()));
        rewritten = rewritten.replace("](" + ref + ")", "](" + uri + ")");
      } else {
        log.debug(
            "Discarding blob '{}' of {} ({} reference(s), mime type {})",
            ref,
            resource,
            occurrences,
            blob.mimeType());
        rewritten = rewritten.replace("](" + ref + ")", "](#" + name + ")");
      }
    }
    media.sort(Comparator.comparing(m -> m.uri().toString()));
    return new Result(rewritten, media);
  }

  /**
   * Names each reference after its last path segment. Collisions get {@code -2}, {@code -3}...
   * before the extension, in order of first occurrence in the text, skipping any name already
   * taken by an earlier reference.
   */
  static Map<String, String> assignNames(String text, Set<String> refs) {
    List<String> ordered = new ArrayList<>(refs);
    ordered.sort(
        Comparator.comparingInt(
            (String ref) -> {
              int at = text.indexOf("](" + ref + ")");
              return at < 0 ? Integer.MAX_VALUE : at;
            }));
    Map<String, String> names = new LinkedHashMap<>();
    Set<String> taken = new HashSet<>();
    for (String ref : ordered) {
      String base = baseName(ref);
      String name = base;
      for (int n = 2; !taken.add(name); n++) {
        name = withSuffix(base, n);
      }
      names.put(ref, name);
    }
    return names;
  }

  static String baseName(String ref) {
    String path = ref;
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) path = path.substring(0, cut);
    while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
    String last = path.substring(path.lastIndexOf('/') + 1);
    String sanitized = last.replaceAll("[^a-zA-Z0-9._-]", "_").replaceAll("_+", "_");
    return sanitized.replaceAll("[._-]", "").isEmpty() ? "media" : sanitized;
  }

  private static String withSuffix(String name, int n) {
    int dot = name.lastIndexOf('.');
    if (dot <= 0) return name + "-" + n;
    return name.substring(0, dot) + "-" + n + name.substring(dot);
  }

  private static int indexOfAny(String s, char a, char b) {
    int i = s.indexOf(a);
    int j = s.indexOf(b);
    if (i < 0) return j;
    if (j < 0) return i;
    return Math.min(i, j);
  }

  private static Map<String, String> altTexts(String text) {
    Map<String, String> alts = new HashMap<>();
    for (MarkdownLinks.Link link : MarkdownLinks.find(text)) {
      if (link.embed() && !link.label().isBlank()) {
        alts.putIfAbsent(link.href(), link.label());
      }
    }
    return alts;
  }
}
