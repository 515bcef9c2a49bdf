package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.elasticsearch.ChunkIndex;
import com.flamingo.ai.ragpipeline.elasticsearch.IndexedChunk;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkStatistics;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TokenWindowChunker;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragpipeline.service.rag.extraction.PdfTextExtractor;
import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.TextChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Orchestrates ingestion: extract, chunk, embed, and index.
 *
 * <p>Documents of a batch run concurrently on the ingestion executor and are reported in input
 * order. A failure is confined to its own document and reported on its result. A document id
 * repeated within a batch is ingested once; the repeats are reported as failed.
 *
 * <p>Re-ingesting a document id overwrites its chunks in place and only then removes chunks left
 * over from a longer earlier version, so a failed write leaves the earlier chunks searchable.
 */
@Service
@Slf4j
public class IngestionService {

  private final PdfTextExtractor textExtractor;
  private final TokenWindowChunker chunker;
  private final EmbeddingService embeddingService;
  private final ChunkIndex chunkIndex;
  private final ExtractionCache extractionCache;
  private final AsyncTaskExecutor ingestionExecutor;
  private final MeterRegistry meterRegistry;

  public IngestionService(
      PdfTextExtractor textExtractor,
      TokenWindowChunker chunker,
      EmbeddingService embeddingService,
      ChunkIndex chunkIndex,
      ExtractionCache extractionCache,
      @Qualifier("ingestionExecutor") AsyncTaskExecutor ingestionExecutor,
      MeterRegistry meterRegistry) {
    this.textExtractor = textExtractor;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.chunkIndex = chunkIndex;
    this.extractionCache = extractionCache;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
  }

  private record DocumentOutcome(IngestionResult result, List<TextChunk> chunks) {}

  /**
   * Ingests a batch of documents.
   *
   * @param sources the documents, in the order results should be reported
   * @return per-document results and batch totals
   */
  @Timed(value = "ingestion.batch", description = "Time to ingest a batch of documents")
  public IngestionReport ingest(List<SourceDocument> sources) {
    log.info("Ingesting batch of {} documents", sources.size());
    List<Future<DocumentOutcome>> pending = new ArrayList<>(sources.size());
    Set<String> documentIds = new HashSet<>();
    for (SourceDocument source : sources) {
      if (documentIds.add(source.id())) {
        pending.add(ingestionExecutor.submit(() -> ingestDocument(source)));
      } else {
        pending.add(CompletableFuture.completedFuture(duplicate(source)));
      }
    }

    List<IngestionResult> results = new ArrayList<>(sources.size());
    List<TextChunk> allChunks = new ArrayList<>();
    for (int i = 0; i < sources.size(); i++) {
      DocumentOutcome outcome = await(pending.get(i), sources.get(i));
      results.add(outcome.result());
      allChunks.addAll(outcome.chunks());
    }

    int failed = (int) results.stream().filter(r -> !r.success()).count();
    IngestionReport report =
        new IngestionReport(
            results,
            results.size() - failed,
            failed,
            allChunks.size(),
            ChunkStatistics.of(allChunks));
    log.info(
        "Ingestion finished: processed={}, failed={}, chunks={}",
        report.documentsProcessed(),
        report.documentsFailed(),
        report.chunksIndexed());
    return report;
  }

  /**
   * Ingests one document; never throws.
   *
   * @param source the document
   * @return the document's result and the chunks indexed for it
   */
  private DocumentOutcome ingestDocument(SourceDocument source) {
    try {
      ExtractedDocument document = extract(source);
      List<TextChunk> chunks = chunker.chunk(document);
      if (chunks.isEmpty()) {
        log.warn("No text in {}, indexing no chunks", source.displayName());
      }

      List<IndexedChunk> indexed = toIndexedChunks(chunks);
      if (indexed.isEmpty()) {
        chunkIndex.deleteByDocumentId(document.documentId());
      } else {
        chunkIndex.upsert(indexed);
        chunkIndex.deleteChunksFrom(document.documentId(), indexed.size());
      }

      meterRegistry.counter("ingestion.documents.success").increment();
      meterRegistry.counter("ingestion.chunks.indexed").increment(chunks.size());
      log.info("Ingested {} as {} chunks", source.displayName(), chunks.size());
      return new DocumentOutcome(IngestionResult.succeeded(document, chunks.size()), chunks);
    } catch (RuntimeException e) {
      log.error("Failed to ingest {}: {}", source.displayName(), e.getMessage(), e);
      meterRegistry.counter("ingestion.documents.failure").increment();
      return new DocumentOutcome(IngestionResult.failed(source, errorMessage(e)), List.of());
    }
  }

  private DocumentOutcome duplicate(SourceDocument source) {
    log.warn(
        "Skipping {}: document id {} already in this batch", source.displayName(), source.id());
    meterRegistry.counter("ingestion.documents.failure").increment();
    return new DocumentOutcome(
        IngestionResult.failed(
            source, "Duplicate document id " + source.id() + " in the same batch"),
        List.of());
  }

  private ExtractedDocument extract(SourceDocument source) {
    String key = ExtractionCache.keyOf(source.content());
    return extractionCache
        .get(key)
        .map(cached -> cached.withSource(source))
        .orElseGet(
            () -> {
              ExtractedDocument document = textExtractor.extract(source);
              extractionCache.put(key, document);
              return document;
            });
  }

  private List<IndexedChunk> toIndexedChunks(List<TextChunk> chunks) {
    if (chunks.isEmpty()) {
      return List.of();
    }
    List<List<Float>> vectors =
        embeddingService.embedAll(chunks.stream().map(TextChunk::text).toList());
    List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      indexed.add(
          IndexedChunk.builder()
              .id(chunk.id())
              .documentId(chunk.documentId())
              .fileName(chunk.fileName())
              .downloadLink(chunk.downloadLink())
              .chunkIndex(chunk.ordinal())
              .content(chunk.text())
              .tokenCount(chunk.tokenCount())
              .firstPage(chunk.firstPage())
              .lastPage(chunk.lastPage())
              .embedding(vectors.get(i))
              .build());
    }
    return indexed;
  }

  private DocumentOutcome await(Future<DocumentOutcome> future, SourceDocument source) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      meterRegistry.counter("ingestion.documents.failure").increment();
      return new DocumentOutcome(
          IngestionResult.failed(source, "Ingestion was interrupted"), List.of());
    } catch (ExecutionException e) {
      log.error("Ingestion task for {} failed", source.displayName(), e.getCause());
      meterRegistry.counter("ingestion.documents.failure").increment();
      return new DocumentOutcome(
          IngestionResult.failed(source, errorMessage(e.getCause())), List.of());
    }
  }

  private static String errorMessage(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }
}
