package com.flamingo.ai.ragpipeline.service.query;

import com.flamingo.ai.ragpipeline.service.rag.retrieval.SearchMode;

/** Service for answering questions over the indexed documents. */
public interface QueryService {

  /**
   * Retrieves passages for a question and synthesizes an answer from them.
   *
   * <p>Null settings fall back to the configured defaults.
   *
   * @param question the question, not blank
   * @param mode search mode, or null
   * @param size maximum number of results, or null
   * @param rrfK Reciprocal Rank Fusion constant, or null
   * @param useLlm whether a language model writes the answer, or null for true
   * @return the answer and ranked results
   * @throws IllegalArgumentException if the question is blank or a setting is out of range
   */
  QueryResult answer(String question, SearchMode mode, Integer size, Integer rrfK, Boolean useLlm);
}
