package com.flamingo.ai.ragpipeline.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.elasticsearch.ChunkIndex;
import com.flamingo.ai.ragpipeline.elasticsearch.IndexedChunk;
import com.flamingo.ai.ragpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.ragpipeline.exception.IndexingException;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TokenCounter;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TokenWindowChunker;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragpipeline.service.rag.extraction.PdfTextExtractor;
import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.PageText;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

  private static final TokenCounter WORDS =
      text -> text.isBlank() ? 0 : text.strip().split("\\s+").length;

  @Mock private PdfTextExtractor textExtractor;
  @Mock private EmbeddingService embeddingService;
  @Mock private ChunkIndex chunkIndex;
  @Mock private ExtractionCache extractionCache;

  private ThreadPoolTaskExecutor executor;
  private SimpleMeterRegistry meterRegistry;
  private IngestionService ingestionService;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setThreadNamePrefix("ingest-test-");
    executor.initialize();
    meterRegistry = new SimpleMeterRegistry();
    ingestionService =
        new IngestionService(
            textExtractor,
            new TokenWindowChunker(WORDS, 4, 1, 512, 0.0),
            embeddingService,
            chunkIndex,
            extractionCache,
            executor,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  private static SourceDocument source(String name) {
    return new SourceDocument(
        SourceDocument.slugOf(name), name, name.getBytes(StandardCharsets.UTF_8), null);
  }

  private IngestionService serviceWith(ChunkIndex index) {
    return new IngestionService(
        textExtractor,
        new TokenWindowChunker(WORDS, 4, 1, 512, 0.0),
        embeddingService,
        index,
        new NoOpExtractionCache(),
        executor,
        meterRegistry);
  }

  private void extractContentAsText() {
    when(textExtractor.extract(any(SourceDocument.class)))
        .thenAnswer(
            invocation -> {
              SourceDocument source = invocation.getArgument(0);
              return extracted(source, new String(source.content(), StandardCharsets.UTF_8));
            });
  }

  private static ExtractedDocument extracted(SourceDocument source, String text) {
    return ExtractedDocument.of(source, List.of(PageText.nativeText(0, text)), Map.of());
  }

  private void embedEverything() {
    when(embeddingService.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<?> texts = invocation.getArgument(0);
              return texts.stream().map(t -> List.of(0.1f, 0.2f)).toList();
            });
  }

  @Nested
  @DisplayName("Successful ingestion")
  class Successful {

    @Test
    @DisplayName("Should extract, chunk, embed and index a document")
    void shouldIngestDocument() {
      SourceDocument contract = source("Contract.pdf");
      when(extractionCache.get(anyString())).thenReturn(Optional.empty());
      when(textExtractor.extract(contract))
          .thenReturn(extracted(contract, "one two three four five six seven"));
      embedEverything();

      IngestionReport report = ingestionService.ingest(List.of(contract));

      assertThat(report.documentsProcessed()).isEqualTo(1);
      assertThat(report.documentsFailed()).isZero();
      assertThat(report.chunksIndexed()).isEqualTo(2);
      IngestionResult result = report.results().get(0);
      assertThat(result.success()).isTrue();
      assertThat(result.fileId()).isEqualTo("contract");
      assertThat(result.chunkCount()).isEqualTo(2);
      assertThat(result.wordCount()).isEqualTo(7);

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<IndexedChunk>> captor = ArgumentCaptor.forClass(List.class);
      InOrder order = inOrder(chunkIndex);
      order.verify(chunkIndex).upsert(captor.capture());
      order.verify(chunkIndex).deleteChunksFrom("contract", 2);
      verify(chunkIndex, never()).deleteByDocumentId(anyString());
      assertThat(captor.getValue())
          .extracting(IndexedChunk::getId)
          .containsExactly("contract_chunk_001", "contract_chunk_002");
      assertThat(captor.getValue()).allSatisfy(c -> assertThat(c.getEmbedding()).hasSize(2));
      verify(extractionCache).put(anyString(), any(ExtractedDocument.class));
    }

    @Test
    @DisplayName("Should treat a blank document as a success with no chunks")
    void shouldAcceptBlankDocument() {
      SourceDocument blank = source("Blank.pdf");
      when(extractionCache.get(anyString())).thenReturn(Optional.empty());
      when(textExtractor.extract(blank)).thenReturn(extracted(blank, ""));

      IngestionReport report = ingestionService.ingest(List.of(blank));

      IngestionResult result = report.results().get(0);
      assertThat(result.success()).isTrue();
      assertThat(result.text()).isEmpty();
      assertThat(result.chunkCount()).isZero();
      verify(embeddingService, never()).embedAll(anyList());
      verify(chunkIndex).deleteByDocumentId("blank");
      verify(chunkIndex, never()).upsert(anyList());
    }

    @Test
    @DisplayName("Should reuse a cached extraction under the current file's identity")
    void shouldUseCachedExtraction() {
      SourceDocument original = source("Old Name.pdf");
      SourceDocument renamed =
          new SourceDocument("new_name", "New Name.pdf", original.content(), null);
      when(extractionCache.get(ExtractionCache.keyOf(original.content())))
          .thenReturn(Optional.of(extracted(original, "cached text")));
      embedEverything();

      IngestionReport report = ingestionService.ingest(List.of(renamed));

      IngestionResult result = report.results().get(0);
      assertThat(result.fileId()).isEqualTo("new_name");
      assertThat(result.fileName()).isEqualTo("New Name.pdf");
      assertThat(result.text()).isEqualTo("cached text");
      verify(textExtractor, never()).extract(any());
      verify(chunkIndex).deleteChunksFrom("new_name", 1);
    }
  }

  @Nested
  @DisplayName("Document identity")
  class DocumentIdentity {

    @Test
    @DisplayName("Should keep files whose names differ only in case apart")
    void shouldSeparateFilesWithCaseOnlyNameDifference() {
      InMemoryChunkIndex index = new InMemoryChunkIndex();
      extractContentAsText();
      embedEverything();
      SourceDocument upper =
          SourceDocument.of(
              "Report.pdf",
              "alpha beta gamma delta epsilon zeta eta theta".getBytes(StandardCharsets.UTF_8));
      SourceDocument lower =
          SourceDocument.of("report.pdf", "iota kappa".getBytes(StandardCharsets.UTF_8));

      IngestionReport report = serviceWith(index).ingest(List.of(upper, lower));

      assertThat(upper.id()).isNotEqualTo(lower.id());
      assertThat(report.results()).allSatisfy(r -> assertThat(r.success()).isTrue());
      assertThat(index.count()).isEqualTo(report.chunksIndexed());
      assertThat(index.chunks.values())
          .extracting(IndexedChunk::getFileName)
          .contains("Report.pdf", "report.pdf");
    }

    @Test
    @DisplayName("Should remove chunks left over from a longer earlier version")
    void shouldTrimChunksOfLongerEarlierVersion() {
      InMemoryChunkIndex index = new InMemoryChunkIndex();
      IngestionService service = serviceWith(index);
      extractContentAsText();
      embedEverything();

      service.ingest(
          List.of(
              new SourceDocument(
                  "doc",
                  "Doc.pdf",
                  "one two three four five six seven eight nine ten"
                      .getBytes(StandardCharsets.UTF_8),
                  null)));
      assertThat(index.count()).isGreaterThan(1);

      service.ingest(
          List.of(
              new SourceDocument(
                  "doc", "Doc.pdf", "short text".getBytes(StandardCharsets.UTF_8), null)));

      assertThat(index.chunks).containsOnlyKeys("doc_chunk_001");
      assertThat(index.chunks.get("doc_chunk_001").getContent()).isEqualTo("short text");
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should isolate a failing document and keep input order")
    void shouldIsolateFailure() {
      SourceDocument broken = source("Broken.pdf");
      SourceDocument good = source("Good.pdf");
      when(extractionCache.get(anyString())).thenReturn(Optional.empty());
      when(textExtractor.extract(broken))
          .thenThrow(new DocumentProcessingException("broken", "Failed to read PDF Broken.pdf"));
      when(textExtractor.extract(good)).thenReturn(extracted(good, "some good text"));
      embedEverything();

      IngestionReport report = ingestionService.ingest(List.of(broken, good));

      assertThat(report.results())
          .extracting(IngestionResult::fileName)
          .containsExactly("Broken.pdf", "Good.pdf");
      assertThat(report.results().get(0).success()).isFalse();
      assertThat(report.results().get(0).error()).contains("Failed to read PDF");
      assertThat(report.results().get(1).success()).isTrue();
      assertThat(report.documentsProcessed()).isEqualTo(1);
      assertThat(report.documentsFailed()).isEqualTo(1);
      assertThat(report.hasFailures()).isTrue();
      assertThat(meterRegistry.counter("ingestion.documents.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report an indexing failure on the document")
    void shouldReportIndexingFailure() {
      SourceDocument contract = source("Contract.pdf");
      when(extractionCache.get(anyString())).thenReturn(Optional.empty());
      when(textExtractor.extract(contract)).thenReturn(extracted(contract, "one two three"));
      embedEverything();
      doThrow(new IndexingException("Bulk indexing to rag-chunks failed: timeout"))
          .when(chunkIndex)
          .upsert(anyList());

      IngestionReport report = ingestionService.ingest(List.of(contract));

      IngestionResult result = report.results().get(0);
      assertThat(result.success()).isFalse();
      assertThat(result.error()).contains("Bulk indexing");
      assertThat(report.chunksIndexed()).isZero();
      assertThat(report.chunkStatistics().totalChunks()).isZero();
      verify(chunkIndex, never()).deleteChunksFrom(anyString(), anyInt());
      verify(chunkIndex, never()).deleteByDocumentId(anyString());
    }

    @Test
    @DisplayName("Should keep the earlier chunks when re-indexing a document fails")
    void shouldKeepEarlierChunksWhenReindexFails() {
      InMemoryChunkIndex index = new InMemoryChunkIndex();
      IngestionService service = serviceWith(index);
      extractContentAsText();
      embedEverything();
      SourceDocument first =
          new SourceDocument(
              "a", "a.pdf", "one two three four".getBytes(StandardCharsets.UTF_8), null);
      service.ingest(List.of(first));
      assertThat(index.count()).isEqualTo(1);

      index.failUpserts = true;
      SourceDocument second =
          new SourceDocument(
              "a", "a.pdf", "five six seven eight nine".getBytes(StandardCharsets.UTF_8), null);
      IngestionReport report = service.ingest(List.of(second));

      assertThat(report.results().get(0).success()).isFalse();
      assertThat(index.count()).isEqualTo(1);
      assertThat(index.chunks.get("a_chunk_001").getContent()).isEqualTo("one two three four");
    }

    @Test
    @DisplayName("Should ingest a repeated document id in a batch only once")
    void shouldRejectRepeatedIdInBatch() {
      InMemoryChunkIndex index = new InMemoryChunkIndex();
      extractContentAsText();
      embedEverything();
      byte[] content = "one two three".getBytes(StandardCharsets.UTF_8);

      IngestionReport report =
          serviceWith(index)
              .ingest(
                  List.of(
                      new SourceDocument("dup", "First.pdf", content, null),
                      new SourceDocument("dup", "Second.pdf", content, null)));

      assertThat(report.results())
          .extracting(IngestionResult::success)
          .containsExactly(true, false);
      assertThat(report.results().get(1).error()).contains("Duplicate document id dup");
      assertThat(report.chunksIndexed()).isEqualTo(1);
      assertThat(index.count()).isEqualTo(1);
    }
  }

  /** Chunk store keeping chunks by id, as the index does. */
  private static final class InMemoryChunkIndex implements ChunkIndex {

    private final Map<String, IndexedChunk> chunks = new ConcurrentHashMap<>();
    private volatile boolean failUpserts;

    @Override
    public void upsert(List<IndexedChunk> batch) {
      if (failUpserts) {
        throw new IndexingException("Bulk indexing to memory failed: rejected");
      }
      batch.forEach(chunk -> chunks.put(chunk.getId(), chunk));
    }

    @Override
    public void deleteByDocumentId(String documentId) {
      chunks.values().removeIf(chunk -> documentId.equals(chunk.getDocumentId()));
    }

    @Override
    public void deleteChunksFrom(String documentId, int fromOrdinal) {
      chunks
          .values()
          .removeIf(
              chunk ->
                  documentId.equals(chunk.getDocumentId())
                      && chunk.getChunkIndex() >= fromOrdinal);
    }

    @Override
    public List<IndexedChunk> keywordSearch(String query, int topK) {
      return List.of();
    }

    @Override
    public List<IndexedChunk> vectorSearch(List<Float> queryVector, int topK) {
      return List.of();
    }

    @Override
    public long count() {
      return chunks.size();
    }

    @Override
    public String getIndexName() {
      return "memory";
    }
  }
}
