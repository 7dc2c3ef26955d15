package com.gentoro.knowledge.ingestion;

/** Counts tokens the way the consuming models would. */
public interface Tokenizer {
  int count(String text);
}
