package com.flamingo.ai.ragpipeline.service.rag.answer;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TokenCounter;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.QueryContext;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns retrieval results into an answer with citations.
 *
 * <p>Results are placed into a grounding context in rank order, each block headed by {@code
 * [Source i: <file name>]}, until the chunk limit is reached or the next block would exceed the
 * token budget. Citations are exactly the file names of the blocks placed, so they never depend on
 * what the model writes. Without results, with generation disabled, or when the model falls back,
 * a deterministic answer built from the context is returned instead. When not even the first
 * readable passage fits the budget, the fallback names the retrieved files but cites nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  static final String NO_RESULTS_ANSWER = "No relevant documents found for your question.";
  static final String NO_TEXT_ANSWER = "The retrieved documents don't contain readable text.";
  static final String OVER_BUDGET_ANSWER =
      "Relevant passages were found in: %s, but none fits the context budget.";
  private static final int EXCERPT_CHARS = 500;

  private final LanguageModelClient languageModelClient;
  private final TokenCounter tokenCounter;
  private final RagConfig ragConfig;

  /** Grounding context sent to the model and the sources it was built from. */
  record GroundingContext(String text, List<String> citations, List<String> passages) {

    boolean isEmpty() {
      return passages.isEmpty();
    }
  }

  /**
   * Produces the answer for a query.
   *
   * @param query the question and its settings
   * @param results retrieval results, most relevant first
   * @return the answer, never null
   */
  public SynthesizedAnswer synthesize(QueryContext query, List<RetrievalResult> results) {
    if (results.isEmpty()) {
      log.info("No retrieval results, returning fallback answer");
      return new SynthesizedAnswer(
          NO_RESULTS_ANSWER, List.of(), 0, SynthesizedAnswer.FALLBACK, "no_results", 0);
    }

    GroundingContext context = buildContext(results);
    if (context.isEmpty()) {
      return emptyContextAnswer(results);
    }

    if (!query.useLlm()) {
      return fallbackAnswer(context, "generation_disabled");
    }

    GenerationOutcome outcome =
        languageModelClient.generate(AnswerPrompts.answerPrompt(context.text(), query.question()));
    if (!outcome.isGenerated()) {
      return fallbackAnswer(context, outcome.fallbackReason());
    }

    log.info(
        "Generated answer from {} passages across {} sources",
        context.passages().size(),
        context.citations().size());
    return new SynthesizedAnswer(
        AnswerPrompts.clean(outcome.text()),
        context.citations(),
        context.citations().size(),
        SynthesizedAnswer.LLM_GENERATED,
        null,
        context.passages().size());
  }

  GroundingContext buildContext(List<RetrievalResult> results) {
    RagConfig.Answer limits = ragConfig.getAnswer();
    StringBuilder text = new StringBuilder();
    Set<String> citations = new LinkedHashSet<>();
    List<String> passages = new ArrayList<>();
    int tokens = 0;

    for (RetrievalResult result : results) {
      if (passages.size() >= limits.getMaxContextChunks()) {
        break;
      }
      String content = result.chunk().getContent();
      if (content == null || content.isBlank()) {
        continue;
      }
      String fileName = result.fileName() != null ? result.fileName() : "Unknown";
      String block =
          "[Source " + (passages.size() + 1) + ": " + fileName + "]\n" + content.strip();
      int blockTokens = tokenCounter.count(block);
      if (tokens + blockTokens > limits.getMaxContextTokens()) {
        log.debug(
            "Context budget reached at {} tokens, next block needs {}", tokens, blockTokens);
        break;
      }
      if (!passages.isEmpty()) {
        text.append("\n\n");
      }
      text.append(block);
      tokens += blockTokens;
      passages.add(content.strip());
      citations.add(fileName);
    }
    return new GroundingContext(text.toString(), List.copyOf(citations), passages);
  }

  private SynthesizedAnswer emptyContextAnswer(List<RetrievalResult> results) {
    List<String> readableFiles =
        results.stream()
            .filter(r -> r.chunk().getContent() != null && !r.chunk().getContent().isBlank())
            .map(r -> r.fileName() != null ? r.fileName() : "Unknown")
            .distinct()
            .toList();
    if (readableFiles.isEmpty()) {
      return new SynthesizedAnswer(
          NO_TEXT_ANSWER, List.of(), 0, SynthesizedAnswer.FALLBACK, "no_readable_context", 0);
    }
    log.warn(
        "No passage fits the context budget of {} tokens",
        ragConfig.getAnswer().getMaxContextTokens());
    return new SynthesizedAnswer(
        String.format(OVER_BUDGET_ANSWER, String.join(", ", readableFiles)),
        List.of(),
        0,
        SynthesizedAnswer.FALLBACK,
        "context_budget_exceeded",
        0);
  }

  private SynthesizedAnswer fallbackAnswer(GroundingContext context, String reason) {
    String excerpt = context.passages().get(0);
    if (excerpt.length() > EXCERPT_CHARS) {
      excerpt = excerpt.substring(0, EXCERPT_CHARS).strip() + "...";
    }
    String answer =
        String.format(
            "Found %d relevant passage(s) in: %s.\n\nTop passage (%s):\n%s",
            context.passages().size(),
            String.join(", ", context.citations()),
            context.citations().get(0),
            excerpt);
    return new SynthesizedAnswer(
        answer,
        context.citations(),
        context.citations().size(),
        SynthesizedAnswer.FALLBACK,
        reason,
        context.passages().size());
  }
}
