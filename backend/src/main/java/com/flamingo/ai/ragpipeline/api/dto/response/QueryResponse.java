package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.query.QueryResult;
import com.flamingo.ai.ragpipeline.service.rag.answer.SynthesizedAnswer;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  static final int PREVIEW_CHARS = 200;

  private String answer;
  private List<String> citations;
  private int sourcesUsed;
  private String generationMethod;
  private String fallbackReason;
  private String searchMode;
  private List<Result> results;

  /** One ranked passage. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Result {
    private String chunkId;
    private String documentId;
    private String fileName;
    private String downloadLink;
    private double score;
    private List<String> foundIn;
    private int firstPage;
    private int lastPage;
    private String preview;
  }

  /** Creates a QueryResponse from a QueryResult. */
  public static QueryResponse fromResult(QueryResult result) {
    SynthesizedAnswer answer = result.answer();
    return QueryResponse.builder()
        .answer(answer.answer())
        .citations(answer.citations())
        .sourcesUsed(answer.sourcesUsed())
        .generationMethod(answer.generationMethod())
        .fallbackReason(answer.fallbackReason())
        .searchMode(result.query().mode().name().toLowerCase(Locale.ROOT))
        .results(result.results().stream().map(QueryResponse::toResult).toList())
        .build();
  }

  private static Result toResult(RetrievalResult result) {
    List<String> foundIn = new ArrayList<>(2);
    if (result.foundInKeyword()) {
      foundIn.add("keyword");
    }
    if (result.foundInVector()) {
      foundIn.add("vector");
    }
    String content = result.chunk().getContent() != null ? result.chunk().getContent() : "";
    String preview =
        content.length() > PREVIEW_CHARS ? content.substring(0, PREVIEW_CHARS) + "..." : content;
    return Result.builder()
        .chunkId(result.chunk().getId())
        .documentId(result.chunk().getDocumentId())
        .fileName(result.fileName())
        .downloadLink(result.chunk().getDownloadLink())
        .score(result.score())
        .foundIn(foundIn)
        .firstPage(result.chunk().getFirstPage())
        .lastPage(result.chunk().getLastPage())
        .preview(preview)
        .build();
  }
}
