package com.flamingo.ai.ragpipeline.service.rag.model;

import com.google.common.hash.Hashing;
import java.util.Locale;
import java.util.Objects;

/**
 * Raw bytes of one source file as handed over by the download or upload layer.
 *
 * @param id stable identifier; chunk ids derive from it, so re-ingesting the same id replaces the
 *     earlier chunks. Defaults to the slug of the display name plus a short content hash, so two
 *     files that differ only in case or folder never share an id
 * @param displayName original file name, used for citations
 * @param content raw PDF bytes
 * @param downloadLink optional link back to the source, may be null
 */
public record SourceDocument(String id, String displayName, byte[] content, String downloadLink) {

  static final int CONTENT_HASH_CHARS = 12;

  public SourceDocument {
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(content, "content");
    if (id == null || id.isBlank()) {
      id = defaultIdOf(displayName, content);
    }
  }

  /** Creates a document whose id is derived from its display name and content. */
  public static SourceDocument of(String displayName, byte[] content) {
    return new SourceDocument(null, displayName, content, null);
  }

  static String defaultIdOf(String displayName, byte[] content) {
    String hash = Hashing.sha256().hashBytes(content).toString();
    return slugOf(displayName) + "_" + hash.substring(0, CONTENT_HASH_CHARS);
  }

  /** Lower-cased file name without the {@code .pdf} suffix and with spaces replaced. */
  public static String slugOf(String displayName) {
    String name = displayName.strip();
    if (name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      name = name.substring(0, name.length() - 4);
    }
    return name.replaceAll("\\s+", "_").toLowerCase(Locale.ROOT);
  }
}
