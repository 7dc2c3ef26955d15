package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.UriFormatException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The suffix of a knowledge URI: either an affordance ({@code $body}, {@code $collection}, {@code
 * $file}, {@code $plain}) or addressable content inside one ({@code $chunk/01/00}, {@code
 * $media/figure.png}, {@code $file/path/to/entry}).
 */
public final class Observable implements Comparable<Observable> {

  public enum Kind {
    BODY("body", Affordance.BODY),
    COLLECTION("collection", Affordance.COLLECTION),
    FILE("file", Affordance.FILE),
    PLAIN("plain", Affordance.PLAIN),
    CHUNK("chunk", Affordance.BODY),
    MEDIA("media", Affordance.BODY);

    private final String keyword;
    private final Affordance affordance;

    Kind(String keyword, Affordance affordance) {
      this.keyword = keyword;
      this.affordance = affordance;
    }

    public String keyword() {
      return keyword;
    }

    static Kind fromKeyword(String keyword) {
      for (Kind k : values()) {
        if (k.keyword.equals(keyword)) return k;
      }
      return null;
    }
  }

  private final Kind kind;
  private final List<String> path;

  private Observable(Kind kind, List<String> path) {
    this.kind = kind;
    this.path = List.copyOf(path);
  }

  public static Observable of(Affordance affordance) {
    return switch (affordance) {
      case BODY -> new Observable(Kind.BODY, List.of());
      case COLLECTION -> new Observable(Kind.COLLECTION, List.of());
      case FILE -> new Observable(Kind.FILE, List.of());
      case PLAIN -> new Observable(Kind.PLAIN, List.of());
    };
  }

  /** A body chunk; an empty index list addresses the only chunk of a single-chunk body. */
  public static Observable chunk(List<Integer> indexes) {
    List<String> path = new ArrayList<>(indexes.size());
    for (Integer index : indexes) {
      if (index == null || index < 0) {
        throw new IllegalArgumentException("Chunk indexes must be non-negative: " + indexes);
      }
      path.add("%02d".formatted(index));
    }
    return new Observable(Kind.CHUNK, path);
  }

  public static Observable media(List<String> path) {
    if (path.isEmpty()) {
      throw new IllegalArgumentException("Media observables need a name");
    }
    return new Observable(Kind.MEDIA, checked(path, "$media"));
  }

  public static Observable file(List<String> path) {
    return new Observable(Kind.FILE, checked(path, "$file"));
  }

  /** Parses a suffix such as {@code $chunk/01/02}. */
  @JsonCreator
  public static Observable parse(String suffix) {
    if (suffix == null || !suffix.startsWith("$")) {
      throw new UriFormatException("Suffix must start with '$'", suffix);
    }
    String[] parts = suffix.substring(1).split("/", -1);
    Kind kind = Kind.fromKeyword(parts[0]);
    if (kind == null) {
      throw new UriFormatException("Unknown affordance keyword: " + parts[0], suffix);
    }
    List<String> rest = Arrays.asList(parts).subList(1, parts.length);
    switch (kind) {
      case BODY, COLLECTION, PLAIN:
        if (!rest.isEmpty()) {
          throw new UriFormatException(
              "$" + kind.keyword() + " does not support observables", suffix);
        }
        return new Observable(kind, List.of());
      case CHUNK:
        for (String index : rest) {
          if (!UriGrammar.CHUNK_INDEX.matcher(index).matches()) {
            throw new UriFormatException("Invalid chunk index: " + index, suffix);
          }
        }
        return new Observable(kind, rest);
      case MEDIA:
        if (rest.isEmpty()) {
          throw new UriFormatException("$media requires a name", suffix);
        }
        return new Observable(kind, checked(rest, suffix));
      case FILE:
        return new Observable(kind, checked(rest, suffix));
      default:
        throw new IllegalStateException("Unhandled observable kind: " + kind);
    }
  }

  public Kind kind() {
    return kind;
  }

  public List<String> path() {
    return path;
  }

  /** The affordance containing this observable ({@code $chunk} and {@code $media} map to body). */
  public Affordance affordance() {
    return kind.affordance;
  }

  /** True when this suffix names a whole affordance rather than content inside one. */
  public boolean isAffordance() {
    return path.isEmpty() && kind != Kind.CHUNK;
  }

  /** Chunk indexes as integers; empty for the single chunk and for non-chunk observables. */
  public List<Integer> chunkIndexes() {
    if (kind != Kind.CHUNK) return List.of();
    List<Integer> indexes = new ArrayList<>(path.size());
    for (String p : path) {
      indexes.add(Integer.parseInt(p));
    }
    return indexes;
  }

  private static List<String> checked(List<String> path, String suffix) {
    for (String segment : path) {
      if (!UriGrammar.isSegment(segment)) {
        throw new UriFormatException("Invalid segment '" + segment + "'", suffix);
      }
    }
    return path;
  }

  @JsonValue
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("$").append(kind.keyword());
    for (String p : path) {
      sb.append('/').append(p);
    }
    return sb.toString();
  }

  @Override
  public int compareTo(Observable o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Observable other)) return false;
    return kind == other.kind && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, path);
  }
}
