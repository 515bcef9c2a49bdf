package com.flamingo.ai.ragpipeline.elasticsearch;

import java.util.List;

/** Document store holding embedded chunks, searchable by keyword and by vector. */
public interface ChunkIndex {

  /**
   * Inserts or replaces chunks by id. Written chunks are visible to searches once this returns.
   *
   * @param chunks chunks with their embeddings
   */
  void upsert(List<IndexedChunk> chunks);

  /**
   * Removes every chunk of a document.
   *
   * @param documentId the owning document id
   */
  void deleteByDocumentId(String documentId);

  /**
   * Removes the chunks of a document from an ordinal on, left over when a new version of the
   * document has fewer chunks than the stored one.
   *
   * @param documentId the owning document id
   * @param fromOrdinal first chunk ordinal to remove
   */
  void deleteChunksFrom(String documentId, int fromOrdinal);

  /**
   * BM25 search over chunk text and file name.
   *
   * @param query free text
   * @param topK maximum number of hits
   * @return hits ordered by relevance, each carrying its native score
   */
  List<IndexedChunk> keywordSearch(String query, int topK);

  /**
   * Nearest-neighbour search by embedding similarity.
   *
   * @param queryVector the query embedding
   * @param topK maximum number of hits
   * @return hits ordered by similarity, each carrying its score
   */
  List<IndexedChunk> vectorSearch(List<Float> queryVector, int topK);

  /** Number of chunks currently stored. */
  long count();

  String getIndexName();
}
