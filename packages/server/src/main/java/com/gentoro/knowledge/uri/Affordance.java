package com.gentoro.knowledge.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.UriFormatException;

/** A named perspective on a resource. */
public enum Affordance {
  BODY("body"),
  COLLECTION("collection"),
  FILE("file"),
  PLAIN("plain");

  private final String keyword;

  Affordance(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  /** The suffix naming this affordance, e.g. {@code $body}. */
  public Observable observable() {
    return Observable.of(this);
  }

  /** Returns the affordance for a keyword, or {@code null} when the keyword is not one. */
  public static Affordance fromKeyword(String keyword) {
    for (Affordance a : values()) {
      if (a.keyword.equals(keyword)) {
        return a;
      }
    }
    return null;
  }

  /** Parses an affordance suffix such as {@code $body}. */
  @JsonCreator
  public static Affordance parse(String suffix) {
    Affordance affordance =
        suffix != null && suffix.startsWith("$") ? fromKeyword(suffix.substring(1)) : null;
    if (affordance == null) {
      throw new UriFormatException("Unknown affordance", suffix);
    }
    return affordance;
  }

  @JsonValue
  @Override
  public String toString() {
    return "$" + keyword;
  }
}
