package com.flamingo.ai.ragpipeline.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch implementation of {@link ChunkIndex}.
 *
 * <p>Chunk text is analyzed for BM25 and the embedding is stored as an indexed cosine {@code
 * dense_vector}. Keyword queries match the content (boost 2.0) and the file name (boost 1.5); kNN
 * queries consider ten candidates per requested hit.
 */
@Service
@Slf4j
public class ChunkIndexService extends AbstractElasticsearchIndexService<IndexedChunk>
    implements ChunkIndex {

  static final int NUM_CANDIDATES_FACTOR = 10;

  @Value("${app.elasticsearch.index-name:rag-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public ChunkIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  @Timed(value = "chunk_index.upsert", description = "Time to upsert chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(List<IndexedChunk> chunks) {
    indexDocuments(chunks);
  }

  @Override
  @Timed(value = "chunk_index.delete", description = "Time to delete a document's chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void deleteByDocumentId(String documentId) {
    deleteBy(Query.of(q -> q.term(t -> t.field("documentId").value(documentId))));
  }

  @Override
  @Timed(value = "chunk_index.delete", description = "Time to delete a document's chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void deleteChunksFrom(String documentId, int fromOrdinal) {
    deleteBy(staleChunksQuery(documentId, fromOrdinal));
  }

  @VisibleForTesting
  static Query staleChunksQuery(String documentId, int fromOrdinal) {
    return Query.of(
        q ->
            q.bool(
                b ->
                    b.filter(f -> f.term(t -> t.field("documentId").value(documentId)))
                        .filter(
                            f ->
                                f.range(
                                    r ->
                                        r.number(
                                            n ->
                                                n.field("chunkIndex")
                                                    .gte((double) fromOrdinal))))));
  }

  @Override
  @Timed(value = "chunk_index.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch")
  public List<IndexedChunk> keywordSearch(String query, int topK) {
    return searchByKeyword(query, topK);
  }

  @Override
  @Timed(value = "chunk_index.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<IndexedChunk> vectorSearch(List<Float> queryVector, int topK) {
    return searchByVector(queryVector, topK);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public long count() {
    return countDocuments();
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids must be keyword for exact term matches
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("fileName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("downloadLink", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put("firstPage", Property.of(p -> p.integer(i -> i)));
    properties.put("lastPage", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "content",
        Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(IndexedChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId());
    document.put("fileName", chunk.getFileName());
    if (chunk.getDownloadLink() != null) {
      document.put("downloadLink", chunk.getDownloadLink());
    }
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    document.put("tokenCount", chunk.getTokenCount());
    document.put("firstPage", chunk.getFirstPage());
    document.put("lastPage", chunk.getLastPage());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected IndexedChunk convertFromDocument(Map<String, Object> source) {
    return IndexedChunk.builder()
        .id((String) source.get("id"))
        .documentId((String) source.get("documentId"))
        .fileName((String) source.get("fileName"))
        .downloadLink((String) source.get("downloadLink"))
        .chunkIndex(intValue(source.get("chunkIndex")))
        .content((String) source.get("content"))
        .tokenCount(intValue(source.get("tokenCount")))
        .firstPage(intValue(source.get("firstPage")))
        .lastPage(intValue(source.get("lastPage")))
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(IndexedChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK) {
    log.debug("Vector search topK={} numCandidates={}", topK, topK * NUM_CANDIDATES_FACTOR);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(topK * NUM_CANDIDATES_FACTOR))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected SearchRequest buildKeywordSearchRequest(String query, int topK) {
    log.debug("Keyword search query='{}' topK={}", query, topK);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.multiMatch(
                            mm ->
                                mm.fields("content^2.0", "fileName^1.5")
                                    .query(query)
                                    .type(TextQueryType.MostFields)))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_index";
  }
}
