package com.gentoro.knowledge.ingestion;

public class EstimatingTokenizer implements Tokenizer {
  /**
   * Very small heuristic: 1 token ~ 4 characters (approx for many LLMs). Replace with an actual
   * tokenizer for accurate token counts.
   */
  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) return 0;
    return Math.max(1, text.length() / 4);
  }
}
