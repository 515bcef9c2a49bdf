package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.exception.OcrException;
import java.awt.image.BufferedImage;

/** Optical character recognition over a rendered page image. */
public interface OcrEngine {

  /**
   * Recognizes the text in a page image.
   *
   * @param pageImage the rasterized page
   * @return recognized text, possibly empty
   * @throws OcrException if recognition could not be performed
   */
  String recognize(BufferedImage pageImage);
}
