package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import java.util.Objects;

/**
 * A validated question and its retrieval settings.
 *
 * @param question the question text, not blank
 * @param mode the searches to run
 * @param size maximum number of results, at least 1
 * @param rrfK Reciprocal Rank Fusion smoothing constant, at least 1
 * @param useLlm whether a language model should write the answer
 */
public record QueryContext(String question, SearchMode mode, int size, int rrfK, boolean useLlm) {

  public QueryContext {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    Objects.requireNonNull(mode, "mode");
    if (size < 1) {
      throw new IllegalArgumentException("Result size must be at least 1: " + size);
    }
    if (rrfK <= 0) {
      throw new IllegalArgumentException("RRF k must be positive: " + rrfK);
    }
    question = question.strip();
  }
}
