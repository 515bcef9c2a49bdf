package com.flamingo.ai.ragpipeline.service.rag.chunking;

import com.flamingo.ai.ragpipeline.service.rag.model.TextChunk;
import java.util.IntSummaryStatistics;
import java.util.List;

/** Token statistics over a set of chunks. */
public record ChunkStatistics(
    int totalChunks,
    long totalDocuments,
    long totalTokens,
    double averageTokens,
    int minTokens,
    int maxTokens) {

  public static ChunkStatistics of(List<TextChunk> chunks) {
    if (chunks.isEmpty()) {
      return new ChunkStatistics(0, 0, 0, 0.0, 0, 0);
    }
    IntSummaryStatistics tokens =
        chunks.stream().mapToInt(TextChunk::tokenCount).summaryStatistics();
    long documents = chunks.stream().map(TextChunk::documentId).distinct().count();
    double average = Math.round(tokens.getAverage() * 10.0) / 10.0;
    return new ChunkStatistics(
        chunks.size(), documents, tokens.getSum(), average, tokens.getMin(), tokens.getMax());
  }
}
