package com.flamingo.ai.ragpipeline.service.query;

import com.flamingo.ai.ragpipeline.service.rag.answer.SynthesizedAnswer;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.QueryContext;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalResult;
import java.util.List;

/** Answer to a question together with the ranked results it was built from. */
public record QueryResult(
    QueryContext query, SynthesizedAnswer answer, List<RetrievalResult> results) {}
