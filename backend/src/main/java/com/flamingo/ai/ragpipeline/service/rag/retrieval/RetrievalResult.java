package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.elasticsearch.IndexedChunk;

/**
 * A retrieved chunk with the score it was ranked by.
 *
 * @param chunk the stored chunk
 * @param score fused RRF score in hybrid mode, the native index score otherwise
 * @param foundInKeyword whether the keyword search returned the chunk
 * @param foundInVector whether the vector search returned the chunk
 */
public record RetrievalResult(
    IndexedChunk chunk, double score, boolean foundInKeyword, boolean foundInVector) {

  public String fileName() {
    return chunk.getFileName();
  }
}
