package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.exception.OcrException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaConfigException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.ocr.TesseractOCRParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * {@link OcrEngine} backed by the Tesseract binary through Apache Tika's OCR parser.
 *
 * <p>The page image is encoded as PNG and parsed with the configured language and page
 * segmentation mode (default {@code 6}, a single uniform block of text). If Tesseract is not
 * installed every call fails with {@link OcrException}; extraction then keeps the native text.
 */
@Component
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  private final TesseractOCRParser parser;
  private final RagConfig.Extraction settings;
  private final boolean available;

  public TesseractOcrEngine(RagConfig ragConfig) {
    this.settings = ragConfig.getExtraction();
    this.parser = new TesseractOCRParser();
    this.available = initialize(parser);
  }

  private static boolean initialize(TesseractOCRParser parser) {
    try {
      parser.initialize(Collections.emptyMap());
      boolean found = !parser.getSupportedTypes(new ParseContext()).isEmpty();
      if (found) {
        log.info("Tesseract OCR available");
      } else {
        log.warn("Tesseract binary not found; scanned pages will keep their native text only");
      }
      return found;
    } catch (TikaConfigException e) {
      log.warn("Tesseract OCR could not be configured: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String recognize(BufferedImage pageImage) {
    if (!available) {
      throw new OcrException("Tesseract OCR is not available");
    }

    TesseractOCRConfig config = new TesseractOCRConfig();
    config.setLanguage(settings.getOcrLanguage());
    config.setPageSegMode(settings.getOcrPageSegMode());
    config.setTimeoutSeconds(settings.getOcrTimeoutSeconds());

    ParseContext context = new ParseContext();
    context.set(TesseractOCRConfig.class, config);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, "image/png");
    BodyContentHandler handler = new BodyContentHandler(-1);

    try (InputStream in = new ByteArrayInputStream(toPng(pageImage))) {
      parser.parse(in, handler, metadata, context);
    } catch (IOException | SAXException | TikaException e) {
      throw new OcrException("Tesseract could not read the page image: " + e.getMessage(), e);
    }

    String text = handler.toString().strip();
    log.debug("OCR recognized {} characters", text.length());
    return text;
  }

  private static byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", out)) {
      throw new IOException("No PNG writer available");
    }
    return out.toByteArray();
  }
}
