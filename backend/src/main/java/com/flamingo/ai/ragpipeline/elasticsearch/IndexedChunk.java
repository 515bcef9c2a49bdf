package com.flamingo.ai.ragpipeline.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A chunk as stored in Elasticsearch: text, embedding and provenance. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexedChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String documentId;
  private String fileName;
  private String downloadLink;
  private int chunkIndex;
  private String content;
  private int tokenCount;
  private int firstPage;
  private int lastPage;
  private List<Float> embedding;

  // Set from the search hit, not stored
  @Builder.Default private Double relevanceScore = 0.0;
}
