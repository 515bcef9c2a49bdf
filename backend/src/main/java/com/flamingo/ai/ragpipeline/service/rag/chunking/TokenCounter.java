package com.flamingo.ai.ragpipeline.service.rag.chunking;

/** Counts model tokens in a piece of text. */
@FunctionalInterface
public interface TokenCounter {

  int count(String text);
}
