package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Decides whether a page's native text layer is too thin to be trusted. */
@Component
public class OcrPolicy {

  private final int threshold;

  @Autowired
  public OcrPolicy(RagConfig ragConfig) {
    this(ragConfig.getExtraction().getOcrThreshold());
  }

  @VisibleForTesting
  public OcrPolicy(int threshold) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("OCR threshold must be positive: " + threshold);
    }
    this.threshold = threshold;
  }

  /**
   * Returns true when a page with {@code nativeCharCount} stripped characters should be OCR'd.
   *
   * @param nativeCharCount length of the stripped native text
   * @return whether OCR should run
   */
  public boolean needsOcr(int nativeCharCount) {
    return nativeCharCount < threshold;
  }

  public int getThreshold() {
    return threshold;
  }
}
