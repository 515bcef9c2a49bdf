package com.flamingo.ai.ragpipeline.service.rag.answer;

import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Calls the chat model with a deadline.
 *
 * <p>The call runs on the generation executor under the {@code llm} Resilience4j time limiter,
 * which cancels it once the deadline passes. Errors, timeouts and empty replies are returned as a
 * fallback {@link GenerationOutcome}; nothing is thrown for them.
 */
@Service
@Slf4j
public class LanguageModelClient {

  public static final String TIME_LIMITER = "llm";

  private final ChatModel chatModel;
  private final TimeLimiter timeLimiter;
  private final AsyncTaskExecutor generationExecutor;
  private final MeterRegistry meterRegistry;

  @Autowired
  public LanguageModelClient(
      ChatModel chatModel,
      TimeLimiterRegistry timeLimiterRegistry,
      @Qualifier("generationExecutor") AsyncTaskExecutor generationExecutor,
      MeterRegistry meterRegistry) {
    this(
        chatModel,
        timeLimiterRegistry.timeLimiter(TIME_LIMITER),
        generationExecutor,
        meterRegistry);
  }

  @VisibleForTesting
  public LanguageModelClient(
      ChatModel chatModel,
      TimeLimiter timeLimiter,
      AsyncTaskExecutor generationExecutor,
      MeterRegistry meterRegistry) {
    this.chatModel = chatModel;
    this.timeLimiter = timeLimiter;
    this.generationExecutor = generationExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Sends a prompt to the chat model within the configured deadline.
   *
   * @param prompt the full prompt
   * @return the generated text, or the reason no text is available
   */
  @Timed(value = "llm.generate", description = "Time to generate an answer")
  public GenerationOutcome generate(String prompt) {
    log.debug("Sending prompt of {} chars to chat model", prompt.length());
    try {
      String text =
          timeLimiter.executeFutureSupplier(
              () -> generationExecutor.submit(() -> chatModel.chat(prompt)));
      if (text == null || text.isBlank()) {
        return fallback("empty_response", "Language model returned no text");
      }
      meterRegistry.counter("llm.generation.success").increment();
      return GenerationOutcome.generated(text);
    } catch (TimeoutException e) {
      return fallback(
          "timeout",
          "Language model did not answer within "
              + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis()
              + " ms");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fallback("interrupted", "Generation was interrupted");
    } catch (Exception e) {
      log.debug("Chat model failure", e);
      return fallback("error", "Language model call failed: " + e.getMessage());
    }
  }

  private GenerationOutcome fallback(String reasonTag, String reason) {
    log.warn("Answer generation falling back: {}", reason);
    meterRegistry.counter("llm.generation.fallback", "reason", reasonTag).increment();
    return GenerationOutcome.fallback(reasonTag);
  }
}
