package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.google.common.hash.Hashing;
import java.util.Optional;

/**
 * Reuses extraction output for identical PDF bytes.
 *
 * <p>Entries are keyed by the SHA-256 of the raw content, so a renamed copy of a file hits the
 * same entry. Callers re-attribute a hit to the current source with {@link
 * ExtractedDocument#withSource}.
 */
public interface ExtractionCache {

  Optional<ExtractedDocument> get(String key);

  void put(String key, ExtractedDocument document);

  static String keyOf(byte[] content) {
    return Hashing.sha256().hashBytes(content).toString();
  }
}
