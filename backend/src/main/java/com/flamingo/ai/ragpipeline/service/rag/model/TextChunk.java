package com.flamingo.ai.ragpipeline.service.rag.model;

/**
 * A token-bounded span of a document's joined page text.
 *
 * @param id deterministic id, {@code <documentId>_chunk_<nnn>}
 * @param documentId owning document
 * @param fileName source file name
 * @param downloadLink link back to the source, may be null
 * @param ordinal 0-based position within the document
 * @param text verbatim substring {@code [startOffset, endOffset)} of the document text
 * @param tokenCount token count of {@code text}
 * @param startOffset inclusive start offset in the document text
 * @param endOffset exclusive end offset in the document text
 * @param firstPage 0-based index of the page the chunk starts on
 * @param lastPage 0-based index of the page the chunk ends on
 */
public record TextChunk(
    String id,
    String documentId,
    String fileName,
    String downloadLink,
    int ordinal,
    String text,
    int tokenCount,
    int startOffset,
    int endOffset,
    int firstPage,
    int lastPage) {

  public static String chunkId(String documentId, int ordinal) {
    return String.format("%s_chunk_%03d", documentId, ordinal + 1);
  }
}
