package com.gentoro.knowledge.utility;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class StringUtility {
  public static final int DESCRIPTION_MAX_WORDS = 50;

  /**
   * Collapses a free-form description to at most {@value #DESCRIPTION_MAX_WORDS} ASCII words,
   * stopping before the first code block. Returns {@code null} for blank input.
   */
  public static String shortenDescription(String description) {
    if (description == null || description.isBlank()) return null;
    String ascii =
        Normalizer.normalize(description, Normalizer.Form.NFKD).replaceAll("[^\\x00-\\x7F]", "");
    ascii = ascii.split("\\{noformat}", 2)[0].split("```", 2)[0];
    String[] words = ascii.trim().split("\\s+");
    if (words.length == 0 || words[0].isEmpty()) return null;
    if (words.length > DESCRIPTION_MAX_WORDS) {
      return String.join(" ", Arrays.copyOf(words, DESCRIPTION_MAX_WORDS)) + "...";
    }
    return String.join(" ", words);
  }

  /** Normalizes {@code <br>} variants and CR/CRLF line endings to LF. */
  public static String normalizeNewlines(String input) {
    if (input == null) return "";
    return input.replaceAll("(?i)<br\\s*/?>", "\n").replaceAll("\\r\\n?", "\n");
  }

  /** GitHub-flavored markdown table. Cells are escaped and flattened to one line. */
  public static String markdownTable(List<String> headers, List<List<String>> rows) {
    StringBuilder sb = new StringBuilder();
    sb.append(row(headers)).append('\n');
    sb.append(headers.stream().map(h -> "---").collect(Collectors.joining(" | ", "| ", " |")));
    for (List<String> r : rows) {
      sb.append('\n').append(row(r));
    }
    return sb.toString();
  }

  private static String row(List<String> cells) {
    return cells.stream()
        .map(StringUtility::cell)
        .collect(Collectors.joining(" | ", "| ", " |"));
  }

  private static String cell(String value) {
    if (value == null) return "";
    return normalizeNewlines(value).replace("|", "\\|").replace('\n', ' ').trim();
  }
}
