package com.flamingo.ai.ragpipeline.service.query;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.rag.answer.AnswerSynthesizer;
import com.flamingo.ai.ragpipeline.service.rag.answer.SynthesizedAnswer;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.HybridRetriever;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.QueryContext;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.SearchMode;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of QueryService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryServiceImpl implements QueryService {

  private final HybridRetriever retriever;
  private final AnswerSynthesizer answerSynthesizer;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "query.answer", description = "Time to answer a question")
  public QueryResult answer(
      String question, SearchMode mode, Integer size, Integer rrfK, Boolean useLlm) {
    RagConfig.Retrieval defaults = ragConfig.getRetrieval();
    QueryContext query =
        new QueryContext(
            question,
            mode != null ? mode : defaults.getDefaultMode(),
            size != null ? size : defaults.getTopK(),
            rrfK != null ? rrfK : defaults.getRrfK(),
            useLlm == null || useLlm);
    log.info(
        "Answering question ({} chars) mode={} size={} useLlm={}",
        query.question().length(),
        query.mode(),
        query.size(),
        query.useLlm());

    List<RetrievalResult> results = retriever.retrieve(query);
    SynthesizedAnswer answer = answerSynthesizer.synthesize(query, results);

    meterRegistry
        .counter("query.answers", "generation_method", answer.generationMethod())
        .increment();
    return new QueryResult(query, answer, results);
  }
}
