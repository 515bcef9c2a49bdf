package com.flamingo.ai.ragpipeline.service.rag.retrieval;

/** Which index searches a query runs. */
public enum SearchMode {
  KEYWORD,
  VECTOR,
  HYBRID
}
