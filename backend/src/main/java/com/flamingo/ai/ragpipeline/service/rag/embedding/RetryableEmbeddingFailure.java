package com.flamingo.ai.ragpipeline.service.rag.embedding;

import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import java.util.function.Predicate;

/**
 * Retry predicate for the {@code embedding} Resilience4j instance: model outages are retried,
 * rejected inputs are not.
 */
public class RetryableEmbeddingFailure implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof EmbeddingException e) {
      return e.isTransientFailure();
    }
    return true;
  }
}
