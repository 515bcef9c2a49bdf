package com.flamingo.ai.ragpipeline.service.rag.model;

/**
 * Text of a single PDF page.
 *
 * @param pageIndex 0-based page position
 * @param text final page text, native and OCR combined
 * @param charCount length of {@code text}
 * @param ocrUsed whether OCR output contributed to {@code text}
 * @param originalCharCount native text length before OCR was considered
 * @param error page-level note when native extraction or OCR failed, otherwise null
 */
public record PageText(
    int pageIndex,
    String text,
    int charCount,
    boolean ocrUsed,
    int originalCharCount,
    String error) {

  /** A page that kept its native text. */
  public static PageText nativeText(int pageIndex, String text) {
    return new PageText(pageIndex, text, text.length(), false, text.length(), null);
  }
}
