package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.api.dto.request.QueryRequest;
import com.flamingo.ai.ragpipeline.api.dto.response.QueryResponse;
import com.flamingo.ai.ragpipeline.service.query.QueryResult;
import com.flamingo.ai.ragpipeline.service.query.QueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for answering questions. */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

  private final QueryService queryService;

  /** Answers a question from the indexed documents. */
  @PostMapping
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    QueryResult result =
        queryService.answer(
            request.getQuestion(),
            request.getMode(),
            request.getSize(),
            request.getRrfK(),
            request.getUseLlm());
    return ResponseEntity.ok(QueryResponse.fromResult(result));
  }
}
