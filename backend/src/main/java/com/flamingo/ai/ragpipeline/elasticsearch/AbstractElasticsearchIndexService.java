package com.flamingo.ai.ragpipeline.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.ragpipeline.exception.IndexingException;
import com.flamingo.ai.ragpipeline.exception.SearchException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch-backed indexes holding embedded documents.
 *
 * <p>Owns index creation and mapping checks, bulk writes, keyword and vector searches, deletes and
 * counts. Subclasses supply the schema, the entity conversion and the search requests. Failures are
 * surfaced as {@link IndexingException} or {@link SearchException}; nothing is silently dropped.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK);

  protected abstract SearchRequest buildKeywordSearchRequest(String query, int topK);

  /**
   * Returns the metric prefix for this index (e.g. "chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  /** Creates the index, or adds missing fields to an existing one. */
  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and fails on type mismatches, which can only be fixed
   * by recreating the index.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expected = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missing = new HashMap<>();
    expected.forEach(
        (field, property) -> {
          Property existing = actual.get(field);
          if (existing == null) {
            missing.put(field, property);
          } else if (existing._kind() != property._kind()) {
            mismatches.add(
                String.format(
                    "field '%s' expected '%s' but found '%s'",
                    field, property._kind(), existing._kind()));
          }
        });

    if (!mismatches.isEmpty()) {
      String message =
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s): "
              + String.join("; ", mismatches)
              + ". Delete the index and restart.";
      log.error(message);
      throw new IllegalStateException(message);
    }

    if (!missing.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(PutMappingRequest.of(p -> p.index(getIndexName()).properties(missing)));
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missing.size(),
          getIndexName(),
          missing.keySet());
    } else {
      log.debug("Index '{}' mapping verified", getIndexName());
    }
  }

  /**
   * Writes documents in one bulk request and waits until they are searchable.
   *
   * @param documents the documents to write
   * @throws IndexingException if the request fails or any item is rejected
   */
  protected void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> source = convertToDocument(document);
      bulk.operations(op -> op.index(idx -> idx.index(getIndexName()).id(id).document(source)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulk.build());
    } catch (IOException | ElasticsearchException e) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new IndexingException(
          "Bulk indexing to " + getIndexName() + " failed: " + e.getMessage(), e);
    }

    if (response.errors()) {
      List<String> failures =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(AbstractElasticsearchIndexService::describeFailure)
              .toList();
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new IndexingException(
          String.format(
              "%d of %d documents rejected by %s: %s",
              failures.size(),
              documents.size(),
              getIndexName(),
              failures.subList(0, Math.min(3, failures.size()))));
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  private static String describeFailure(BulkResponseItem item) {
    return item.id() + ": " + item.error().reason();
  }

  protected List<T> searchByVector(List<Float> queryEmbedding, int topK) {
    return search(
        "vector",
        "dims=" + queryEmbedding.size(),
        () -> buildVectorSearchRequest(queryEmbedding, topK));
  }

  protected List<T> searchByKeyword(String query, int topK) {
    return search("keyword", query, () -> buildKeywordSearchRequest(query, topK));
  }

  @SuppressWarnings("rawtypes")
  private List<T> search(
      String searchType, String param, Supplier<SearchRequest> request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request.get(), Map.class);
      logSearchResults(searchType, param, response);
      meterRegistry.counter(getMetricPrefix() + "." + searchType + "_search").increment();
      return mapHitsToDocuments(response.hits().hits());
    } catch (IOException | ElasticsearchException e) {
      meterRegistry.counter(getMetricPrefix() + "." + searchType + "_search.errors").increment();
      throw new SearchException(
          searchType + " search on " + getIndexName() + " failed: " + e.getMessage(), e);
    }
  }

  /**
   * Deletes all documents matching a query.
   *
   * @param query the selection
   * @throws IndexingException if the delete fails
   */
  protected void deleteBy(Query query) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(getIndexName())
                      .query(query)
                      .refresh(true)
                      .conflicts(Conflicts.Proceed));
      var response = elasticsearchClient.deleteByQuery(request);
      log.info("Deleted {} documents from {}", response.deleted(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException | ElasticsearchException e) {
      throw new IndexingException(
          "Delete from " + getIndexName() + " failed: " + e.getMessage(), e);
    }
  }

  /** Number of documents in the index. */
  protected long countDocuments() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException | ElasticsearchException e) {
      throw new SearchException("Count on " + getIndexName() + " failed: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private void logSearchResults(String searchType, String param, SearchResponse<Map> response) {
    List<Hit<Map>> hits = response.hits().hits();
    long totalHits =
        response.hits().total() != null ? response.hits().total().value() : hits.size();
    log.info(
        "[{}] index={} param='{}' totalHits={} returned={}",
        searchType,
        getIndexName(),
        param,
        totalHits,
        hits.size());
    if (!log.isDebugEnabled()) {
      return;
    }
    for (int i = 0; i < hits.size(); i++) {
      Hit<Map> hit = hits.get(i);
      Map<String, Object> src = hit.source();
      String preview = "";
      if (src != null && src.get("content") instanceof String s) {
        preview = s.length() > 120 ? s.substring(0, 120) + "..." : s;
      }
      log.debug(
          "  [{}] rank={} id={} score={} content='{}'",
          searchType,
          i + 1,
          hit.id(),
          hit.score(),
          preview);
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      // _id is hit metadata, not part of _source
      source.put("id", hit.id());
      T document = convertFromDocument(source);
      if (document instanceof ScoredDocument scored && hit.score() != null) {
        scored.setRelevanceScore(hit.score());
      }
      documents.add(document);
    }
    return documents;
  }

  /** Marker interface for documents that carry the relevance score of the hit. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
