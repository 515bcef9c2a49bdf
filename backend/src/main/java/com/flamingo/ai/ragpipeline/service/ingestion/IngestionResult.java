package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.PageText;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import java.util.List;
import java.util.Map;

/**
 * Outcome of ingesting one file. A failed file keeps its identity fields and carries the error;
 * everything else is empty.
 */
public record IngestionResult(
    String fileId,
    String fileName,
    String downloadLink,
    boolean success,
    String text,
    int pageCount,
    int charCount,
    int wordCount,
    int ocrPagesCount,
    Map<String, String> metadata,
    List<PageText> pages,
    int chunkCount,
    String error) {

  static IngestionResult succeeded(ExtractedDocument document, int chunkCount) {
    return new IngestionResult(
        document.documentId(),
        document.fileName(),
        document.downloadLink(),
        true,
        document.text(),
        document.pageCount(),
        document.charCount(),
        document.wordCount(),
        document.ocrPageCount(),
        document.metadata(),
        document.pages(),
        chunkCount,
        null);
  }

  static IngestionResult failed(SourceDocument source, String error) {
    return new IngestionResult(
        source.id(),
        source.displayName(),
        source.downloadLink(),
        false,
        "",
        0,
        0,
        0,
        0,
        Map.of(),
        List.of(),
        0,
        error);
  }
}
