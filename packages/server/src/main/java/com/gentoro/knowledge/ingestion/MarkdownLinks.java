package com.gentoro.knowledge.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds and rewrites inline markdown links: {@code [label](href)} and {@code ![alt](href)}. */
final class MarkdownLinks {
  static final Pattern LINK = Pattern.compile("(!?)\\[([^\\]\\n]*)]\\(([^)\\s]+)\\)");

  record Link(boolean embed, String label, String href) {}

  private MarkdownLinks() {}

  static List<Link> find(String text) {
    List<Link> links = new ArrayList<>();
    Matcher m = LINK.matcher(text);
    while (m.find()) {
      links.add(new Link(!m.group(1).isEmpty(), m.group(2), m.group(3)));
    }
    return links;
  }

  /** Replaces hrefs for which {@code replacement} returns a non-null value. */
  static String rewrite(String text, Function<Link, String> replacement) {
    Matcher m = LINK.matcher(text);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      Link link = new Link(!m.group(1).isEmpty(), m.group(2), m.group(3));
      String href = replacement.apply(link);
      String rendered =
          href == null ? m.group() : m.group(1) + "[" + m.group(2) + "](" + href + ")";
      m.appendReplacement(sb, Matcher.quoteReplacement(rendered));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** Number of occurrences of {@code ](ref)} in the text. */
  static int countReferences(String text, String ref) {
    String needle = "](" + ref + ")";
    int count = 0;
    int from = text.indexOf(needle);
    while (from >= 0) {
      count++;
      from = text.indexOf(needle, from + needle.length());
    }
    return count;
  }
}
