package com.flamingo.ai.ragpipeline.service.rag.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Page-level text of one PDF plus document statistics.
 *
 * <p>{@code text} is the page texts joined with a newline and stripped. Chunk offsets refer to this
 * string.
 */
public record ExtractedDocument(
    String documentId,
    String fileName,
    String downloadLink,
    List<PageText> pages,
    Map<String, String> metadata,
    String text,
    int pageCount,
    int charCount,
    int wordCount,
    int ocrPageCount) {

  public ExtractedDocument {
    pages = List.copyOf(pages);
    metadata = Map.copyOf(metadata);
  }

  /** Builds the document and derives its joined text and statistics from the pages. */
  public static ExtractedDocument of(
      SourceDocument source, List<PageText> pages, Map<String, String> metadata) {
    String text = pages.stream().map(PageText::text).collect(Collectors.joining("\n")).strip();
    int ocrPages = (int) pages.stream().filter(PageText::ocrUsed).count();
    return new ExtractedDocument(
        source.id(),
        source.displayName(),
        source.downloadLink(),
        pages,
        metadata,
        text,
        pages.size(),
        text.length(),
        countWords(text),
        ocrPages);
  }

  /** Returns a copy attributed to another source; used when a cached extraction is reused. */
  public ExtractedDocument withSource(SourceDocument source) {
    return new ExtractedDocument(
        source.id(),
        source.displayName(),
        source.downloadLink(),
        pages,
        metadata,
        text,
        pageCount,
        charCount,
        wordCount,
        ocrPageCount);
  }

  static int countWords(String text) {
    if (text.isBlank()) {
      return 0;
    }
    return text.strip().split("\\s+").length;
  }
}
