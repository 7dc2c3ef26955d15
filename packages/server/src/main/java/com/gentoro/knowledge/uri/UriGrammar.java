package com.gentoro.knowledge.uri;

import java.util.regex.Pattern;

/** Character-level rules shared by every part of a knowledge URI. */
final class UriGrammar {
  static final Pattern REALM = Pattern.compile("[a-z][a-z0-9]+(?:-[a-z0-9]+)*");
  static final Pattern SEGMENT = Pattern.compile("[a-zA-Z0-9._\\-]+");
  static final Pattern PUNCTUATION_ONLY = Pattern.compile("[._\\-]+");
  static final Pattern CHUNK_INDEX = Pattern.compile("[0-9]{2,}");

  private UriGrammar() {}

  static boolean isRealm(String value) {
    return value != null && REALM.matcher(value).matches();
  }

  static boolean isSegment(String value) {
    return value != null
        && SEGMENT.matcher(value).matches()
        && !PUNCTUATION_ONLY.matcher(value).matches();
  }
}
