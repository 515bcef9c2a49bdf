package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.elasticsearch.ChunkIndex;
import com.flamingo.ai.ragpipeline.elasticsearch.IndexedChunk;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import com.flamingo.ai.ragpipeline.exception.SearchException;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HybridRetriever Tests")
class HybridRetrieverTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private ChunkIndex chunkIndex;
  @Mock private EmbeddingService embeddingService;

  private SimpleMeterRegistry meterRegistry;
  private HybridRetriever retriever;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    retriever = new HybridRetriever(chunkIndex, embeddingService, new RagConfig(), meterRegistry);
  }

  private static IndexedChunk chunk(String id, double score) {
    return IndexedChunk.builder()
        .id(id)
        .documentId("doc")
        .fileName(id + ".pdf")
        .chunkIndex(id.charAt(0))
        .content("content of " + id)
        .relevanceScore(score)
        .build();
  }

  private static QueryContext query(SearchMode mode, int size) {
    return new QueryContext("what is a contract?", mode, size, 60, true);
  }

  private static List<String> ids(List<RetrievalResult> results) {
    return results.stream().map(r -> r.chunk().getId()).toList();
  }

  @Nested
  @DisplayName("Hybrid mode")
  class Hybrid {

    @Test
    @DisplayName("Should fuse keyword and vector rankings with RRF")
    void shouldFuseRankings() {
      when(chunkIndex.keywordSearch(eq("what is a contract?"), anyInt()))
          .thenReturn(List.of(chunk("a", 9), chunk("b", 8), chunk("c", 7)));
      when(embeddingService.embed("what is a contract?")).thenReturn(VECTOR);
      when(chunkIndex.vectorSearch(eq(VECTOR), anyInt()))
          .thenReturn(List.of(chunk("c", 0.9), chunk("a", 0.8), chunk("d", 0.7)));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.HYBRID, 10));

      assertThat(ids(results)).containsExactly("a", "c", "b", "d");
      assertThat(results.get(0).score()).isCloseTo(1.0 / 61 + 1.0 / 62, within(1e-12));
      assertThat(results.get(0).foundInKeyword()).isTrue();
      assertThat(results.get(0).foundInVector()).isTrue();
      assertThat(results.get(2).foundInVector()).isFalse();
      assertThat(results.get(3).foundInKeyword()).isFalse();
    }

    @Test
    @DisplayName("Should over-fetch candidates and truncate to size")
    void shouldOverFetchAndTruncate() {
      when(chunkIndex.keywordSearch(anyString(), eq(6)))
          .thenReturn(List.of(chunk("a", 9), chunk("b", 8), chunk("c", 7)));
      when(embeddingService.embed(anyString())).thenReturn(VECTOR);
      when(chunkIndex.vectorSearch(VECTOR, 6)).thenReturn(List.of(chunk("d", 0.9)));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.HYBRID, 2));

      assertThat(results).hasSize(2);
      verify(chunkIndex).keywordSearch("what is a contract?", 6);
      verify(chunkIndex).vectorSearch(VECTOR, 6);
    }

    @Test
    @DisplayName("Should degrade to keyword results when the vector side fails")
    void shouldDegradeToKeyword() {
      when(chunkIndex.keywordSearch(anyString(), anyInt()))
          .thenReturn(List.of(chunk("a", 9), chunk("b", 8)));
      when(embeddingService.embed(anyString()))
          .thenThrow(new EmbeddingException("model down", new RuntimeException("503")));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.HYBRID, 5));

      assertThat(ids(results)).containsExactly("a", "b");
      assertThat(results).allMatch(RetrievalResult::foundInKeyword);
      assertThat(
              meterRegistry.counter("rag.search.degraded", "failed_mode", "vector").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should degrade to vector results when the keyword side fails")
    void shouldDegradeToVector() {
      when(chunkIndex.keywordSearch(anyString(), anyInt()))
          .thenThrow(new SearchException("index unavailable"));
      when(embeddingService.embed(anyString())).thenReturn(VECTOR);
      when(chunkIndex.vectorSearch(eq(VECTOR), anyInt())).thenReturn(List.of(chunk("d", 0.9)));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.HYBRID, 5));

      assertThat(ids(results)).containsExactly("d");
      assertThat(results.get(0).foundInVector()).isTrue();
    }

    @Test
    @DisplayName("Should fail when both searches fail")
    void shouldFailWhenBothFail() {
      when(chunkIndex.keywordSearch(anyString(), anyInt()))
          .thenThrow(new SearchException("keyword down"));
      when(embeddingService.embed(anyString())).thenThrow(new EmbeddingException("embed down"));

      assertThatThrownBy(() -> retriever.retrieve(query(SearchMode.HYBRID, 5)))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("Both keyword and vector search failed")
          .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }
  }

  @Nested
  @DisplayName("Single modes")
  class SingleModes {

    @Test
    @DisplayName("Keyword mode should use native scores and skip embedding")
    void keywordModeShouldUseNativeScores() {
      when(chunkIndex.keywordSearch("what is a contract?", 3))
          .thenReturn(List.of(chunk("a", 4.2), chunk("b", 3.1)));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.KEYWORD, 3));

      assertThat(ids(results)).containsExactly("a", "b");
      assertThat(results.get(0).score()).isEqualTo(4.2);
      assertThat(results.get(0).foundInKeyword()).isTrue();
      assertThat(results.get(0).foundInVector()).isFalse();
      verify(embeddingService, never()).embed(anyString());
    }

    @Test
    @DisplayName("Vector mode should embed the question and search by vector")
    void vectorModeShouldSearchByVector() {
      when(embeddingService.embed("what is a contract?")).thenReturn(VECTOR);
      when(chunkIndex.vectorSearch(VECTOR, 3)).thenReturn(List.of(chunk("c", 0.91)));

      List<RetrievalResult> results = retriever.retrieve(query(SearchMode.VECTOR, 3));

      assertThat(ids(results)).containsExactly("c");
      assertThat(results.get(0).score()).isEqualTo(0.91);
      verify(chunkIndex, never()).keywordSearch(anyString(), anyInt());
    }

    @Test
    @DisplayName("Keyword mode should propagate a search failure")
    void keywordModeShouldPropagateFailure() {
      when(chunkIndex.keywordSearch(anyString(), anyInt()))
          .thenThrow(new SearchException("down"));

      assertThatThrownBy(() -> retriever.retrieve(query(SearchMode.KEYWORD, 3)))
          .isInstanceOf(SearchException.class);
    }
  }

  @Test
  @DisplayName("Candidate count should be bounded by the configured cap but never below size")
  void candidateCountShouldBeBounded() {
    assertThat(retriever.candidateCount(5)).isEqualTo(15);
    assertThat(retriever.candidateCount(20)).isEqualTo(50);
    assertThat(retriever.candidateCount(80)).isEqualTo(80);
  }
}
