package com.flamingo.ai.ragpipeline.service.rag.answer;

import java.util.List;

/**
 * Answer text plus the sources that grounded it.
 *
 * @param answer generated or fallback answer text
 * @param citations distinct file names placed in the grounding context, in first-use order
 * @param sourcesUsed number of citations
 * @param generationMethod {@value #LLM_GENERATED} or {@value #FALLBACK}
 * @param fallbackReason why no generated text was used, null when generated
 * @param contextChunks number of chunks placed in the grounding context
 */
public record SynthesizedAnswer(
    String answer,
    List<String> citations,
    int sourcesUsed,
    String generationMethod,
    String fallbackReason,
    int contextChunks) {

  public static final String LLM_GENERATED = "llm_generated";
  public static final String FALLBACK = "fallback";

  public SynthesizedAnswer {
    citations = List.copyOf(citations);
  }

  public boolean isGenerated() {
    return LLM_GENERATED.equals(generationMethod);
  }
}
