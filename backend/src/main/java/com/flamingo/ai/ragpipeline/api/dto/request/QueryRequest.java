package com.flamingo.ai.ragpipeline.api.dto.request;

import com.flamingo.ai.ragpipeline.service.rag.retrieval.SearchMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. Omitted settings use the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 4000, message = "Question must not exceed 4000 characters")
  private String question;

  private SearchMode mode;

  @Positive(message = "Size must be positive")
  @Max(value = 50, message = "Size must not exceed 50")
  private Integer size;

  @Positive(message = "RRF k must be positive")
  private Integer rrfK;

  private Boolean useLlm;
}
