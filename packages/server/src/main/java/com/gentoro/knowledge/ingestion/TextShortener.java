package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.exception.IngestionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Trims text that cannot be chunked (plain and data fragments, markdown that is not cached) once it
 * exceeds a threshold, keeping whole lines and appending {@code ... (N lines omitted)}.
 */
public class TextShortener {
  private final Tokenizer tokenizer;

  public TextShortener(Tokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  /**
   * Returns {@code text} unchanged when it fits in {@code thresholdTokens}, otherwise its leading
   * lines up to {@code trimmedMaxTokens}.
   *
   * @throws IngestionException when even the first line exceeds the trimmed budget
   */
  public String shorten(String text, int thresholdTokens, int trimmedMaxTokens) {
    int budget = trimmedMaxTokens > 0 ? trimmedMaxTokens : thresholdTokens;
    if (tokenizer.count(text) <= thresholdTokens) {
      return text;
    }

    List<String> lines = splitKeepEnds(text);
    StringBuilder selected = new StringBuilder();
    int selectedTokens = 0;
    int selectedLines = 0;
    for (String line : lines) {
      int lineTokens = tokenizer.count(line);
      if (selectedTokens + lineTokens > budget) break;
      selected.append(line);
      selectedTokens += lineTokens;
      selectedLines++;
    }
    if (selectedLines == 0) {
      throw new IngestionException("The content is too large to be shortened line by line");
    }
    int omitted = lines.size() - selectedLines;
    return selected.toString().stripTrailing() + "\n\n... (" + omitted + " lines omitted)";
  }

  static List<String> splitKeepEnds(String text) {
    List<String> lines = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        lines.add(text.substring(start, i + 1));
        start = i + 1;
      }
    }
    if (start < text.length()) {
      lines.add(text.substring(start));
    }
    return lines;
  }
}
