package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.ingestion.IngestionReport;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionResult;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkStatistics;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

  public static final String SUCCESS = "success";
  public static final String PARTIAL = "partial";
  public static final String FAILED = "failed";

  private String status;
  private String message;
  private int documentsProcessed;
  private int documentsFailed;
  private int chunksIndexed;
  private List<IngestionResult> results;
  private ChunkStatistics chunkStatistics;

  /** Creates an IngestResponse from an IngestionReport. */
  public static IngestResponse fromReport(IngestionReport report) {
    String status;
    if (!report.hasFailures()) {
      status = SUCCESS;
    } else if (report.documentsProcessed() > 0) {
      status = PARTIAL;
    } else {
      status = FAILED;
    }
    String message =
        String.format(
            "Processed %d of %d documents into %d chunks",
            report.documentsProcessed(), report.results().size(), report.chunksIndexed());
    return IngestResponse.builder()
        .status(status)
        .message(message)
        .documentsProcessed(report.documentsProcessed())
        .documentsFailed(report.documentsFailed())
        .chunksIndexed(report.chunksIndexed())
        .results(report.results())
        .chunkStatistics(report.chunkStatistics())
        .build();
  }
}
