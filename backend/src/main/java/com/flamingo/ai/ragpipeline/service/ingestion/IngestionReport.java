package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkStatistics;
import java.util.List;

/** Results of one ingestion batch, in input order, with batch totals. */
public record IngestionReport(
    List<IngestionResult> results,
    int documentsProcessed,
    int documentsFailed,
    int chunksIndexed,
    ChunkStatistics chunkStatistics) {

  public boolean hasFailures() {
    return documentsFailed > 0;
  }
}
