package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Cache used when {@code rag.cache.enabled} is off: every lookup misses. */
@Component
@ConditionalOnProperty(name = "rag.cache.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpExtractionCache implements ExtractionCache {

  @Override
  public Optional<ExtractedDocument> get(String key) {
    return Optional.empty();
  }

  @Override
  public void put(String key, ExtractedDocument document) {
    // nothing is kept
  }
}
