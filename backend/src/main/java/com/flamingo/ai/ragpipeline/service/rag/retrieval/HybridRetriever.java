package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.elasticsearch.ChunkIndex;
import com.flamingo.ai.ragpipeline.elasticsearch.IndexedChunk;
import com.flamingo.ai.ragpipeline.exception.SearchException;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves chunks for a question by keyword search, vector search, or both fused with {@link
 * ReciprocalRankFusion}.
 *
 * <p>In hybrid mode both searches over-fetch {@code max(size, min(size * multiplier, cap))}
 * candidates. If one of them fails the other one's ranking is used alone; only when both fail is
 * the query failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

  static final int KEYWORD_LIST = 0;
  static final int VECTOR_LIST = 1;

  private static final Comparator<IndexedChunk> DOCUMENT_ORDER =
      Comparator.comparing(IndexedChunk::getDocumentId, Comparator.nullsLast(String::compareTo))
          .thenComparingInt(IndexedChunk::getChunkIndex);

  private final ChunkIndex chunkIndex;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the searches requested by the query context.
   *
   * @param query the validated question and settings
   * @return at most {@code query.size()} results, most relevant first
   * @throws SearchException if the requested search (or, in hybrid mode, both searches) failed
   */
  public List<RetrievalResult> retrieve(QueryContext query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<RetrievalResult> results =
          switch (query.mode()) {
            case KEYWORD -> keywordOnly(query);
            case VECTOR -> vectorOnly(query);
            case HYBRID -> hybrid(query);
          };
      log.info(
          "Retrieved {} results for mode={} size={} k={}",
          results.size(),
          query.mode(),
          query.size(),
          query.rrfK());
      meterRegistry.counter("rag.search.requests", "mode", query.mode().name()).increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("rag.search.latency"));
    }
  }

  private List<RetrievalResult> keywordOnly(QueryContext query) {
    return chunkIndex.keywordSearch(query.question(), query.size()).stream()
        .limit(query.size())
        .map(chunk -> new RetrievalResult(chunk, scoreOf(chunk), true, false))
        .toList();
  }

  private List<RetrievalResult> vectorOnly(QueryContext query) {
    List<Float> vector = embeddingService.embed(query.question());
    return chunkIndex.vectorSearch(vector, query.size()).stream()
        .limit(query.size())
        .map(chunk -> new RetrievalResult(chunk, scoreOf(chunk), false, true))
        .toList();
  }

  private List<RetrievalResult> hybrid(QueryContext query) {
    int candidates = candidateCount(query.size());

    List<IndexedChunk> keywordHits = null;
    RuntimeException keywordFailure = null;
    try {
      keywordHits = chunkIndex.keywordSearch(query.question(), candidates);
    } catch (RuntimeException e) {
      keywordFailure = e;
    }

    List<IndexedChunk> vectorHits = null;
    RuntimeException vectorFailure = null;
    try {
      List<Float> vector = embeddingService.embed(query.question());
      vectorHits = chunkIndex.vectorSearch(vector, candidates);
    } catch (RuntimeException e) {
      vectorFailure = e;
    }

    if (keywordFailure != null && vectorFailure != null) {
      meterRegistry.counter("rag.search.failed").increment();
      SearchException failure =
          new SearchException(
              "Both keyword and vector search failed: " + keywordFailure.getMessage(),
              keywordFailure);
      failure.addSuppressed(vectorFailure);
      throw failure;
    }
    if (keywordFailure != null) {
      log.warn("Keyword search failed, using vector results only: {}", keywordFailure.getMessage());
      meterRegistry.counter("rag.search.degraded", "failed_mode", "keyword").increment();
      keywordHits = List.of();
    }
    if (vectorFailure != null) {
      log.warn("Vector search failed, using keyword results only: {}", vectorFailure.getMessage());
      meterRegistry.counter("rag.search.degraded", "failed_mode", "vector").increment();
      vectorHits = List.of();
    }

    log.debug(
        "Fusing {} keyword and {} vector candidates", keywordHits.size(), vectorHits.size());
    List<List<IndexedChunk>> rankings = new ArrayList<>(2);
    rankings.add(keywordHits);
    rankings.add(vectorHits);

    return ReciprocalRankFusion.fuse(
            rankings, IndexedChunk::getId, DOCUMENT_ORDER, query.rrfK(), query.size())
        .stream()
        .map(
            fused ->
                new RetrievalResult(
                    fused.item(),
                    fused.score(),
                    fused.foundIn(KEYWORD_LIST),
                    fused.foundIn(VECTOR_LIST)))
        .toList();
  }

  int candidateCount(int size) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    return Math.max(
        size, Math.min(size * retrieval.getCandidatesMultiplier(), retrieval.getMaxCandidates()));
  }

  private static double scoreOf(IndexedChunk chunk) {
    return chunk.getRelevanceScore() != null ? chunk.getRelevanceScore() : 0.0;
  }
}
