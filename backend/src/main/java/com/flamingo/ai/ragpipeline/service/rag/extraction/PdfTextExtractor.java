package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.PageText;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Extracts page-level text from PDF documents using Apache PDFBox 3.x.
 *
 * <p>Each page is first read from its text layer. Pages whose stripped native text is shorter than
 * the {@link OcrPolicy} threshold are rasterized at the configured scale and passed to the {@link
 * OcrEngine}; the recognized text is appended to whatever native text the page had. OCR and
 * per-page read failures are recorded on the page and never abort the document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfTextExtractor {

  private final OcrPolicy ocrPolicy;
  private final OcrEngine ocrEngine;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts every page of a PDF.
   *
   * @param source the PDF bytes and their identity
   * @return pages, metadata and statistics
   * @throws DocumentProcessingException if the bytes cannot be opened as a PDF
   */
  @Timed(value = "extraction.document", description = "Time to extract a PDF document")
  public ExtractedDocument extract(SourceDocument source) {
    log.info("Extracting text from {}", source.displayName());
    try (PDDocument pdf = Loader.loadPDF(source.content())) {
      int pageCount = pdf.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      PDFRenderer renderer = new PDFRenderer(pdf);

      List<PageText> pages = new ArrayList<>(pageCount);
      for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
        pages.add(extractPage(stripper, renderer, pdf, pageIndex));
      }

      ExtractedDocument document = ExtractedDocument.of(source, pages, readMetadata(pdf));
      log.info(
          "Extracted {}: pages={}, chars={}, words={}, ocrPages={}",
          source.displayName(),
          document.pageCount(),
          document.charCount(),
          document.wordCount(),
          document.ocrPageCount());
      return document;
    } catch (IOException e) {
      log.error("Failed to open PDF {}: {}", source.displayName(), e.getMessage());
      meterRegistry.counter("extraction.documents.failure").increment();
      throw new DocumentProcessingException(
          source.id(), "Failed to read PDF " + source.displayName() + ": " + e.getMessage(), e);
    }
  }

  private PageText extractPage(
      PDFTextStripper stripper, PDFRenderer renderer, PDDocument pdf, int pageIndex) {
    String nativeText = "";
    String readError = null;
    try {
      stripper.setStartPage(pageIndex + 1);
      stripper.setEndPage(pageIndex + 1);
      nativeText = stripper.getText(pdf).strip();
    } catch (IOException | RuntimeException e) {
      log.warn("Could not read text layer of page {}: {}", pageIndex, e.getMessage());
      readError = "Text extraction failed: " + e.getMessage();
    }

    if (!ocrPolicy.needsOcr(nativeText.length())) {
      return PageText.nativeText(pageIndex, nativeText);
    }

    log.debug(
        "Page {} has {} native characters (< {}), running OCR",
        pageIndex,
        nativeText.length(),
        ocrPolicy.getThreshold());
    try {
      BufferedImage image =
          renderer.renderImage(pageIndex, ragConfig.getExtraction().getRenderScale());
      String ocrText = ocrEngine.recognize(image).strip();
      String combined = nativeText.isEmpty() ? ocrText : (nativeText + "\n" + ocrText).strip();
      meterRegistry.counter("extraction.ocr.pages").increment();
      return new PageText(
          pageIndex, combined, combined.length(), true, nativeText.length(), readError);
    } catch (IOException | RuntimeException e) {
      log.warn("OCR failed for page {}: {}", pageIndex, e.getMessage());
      meterRegistry.counter("extraction.ocr.failures").increment();
      String ocrError = "OCR failed: " + e.getMessage();
      return new PageText(
          pageIndex,
          nativeText,
          nativeText.length(),
          false,
          nativeText.length(),
          readError == null ? ocrError : readError + "; " + ocrError);
    }
  }

  private Map<String, String> readMetadata(PDDocument pdf) {
    Map<String, String> metadata = new LinkedHashMap<>();
    PDDocumentInformation info = pdf.getDocumentInformation();
    if (info == null) {
      return metadata;
    }
    if (info.getTitle() != null && !info.getTitle().isBlank()) {
      metadata.put("title", info.getTitle().strip());
    }
    if (info.getAuthor() != null && !info.getAuthor().isBlank()) {
      metadata.put("author", info.getAuthor().strip());
    }
    return metadata;
  }
}
