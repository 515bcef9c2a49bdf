package com.flamingo.ai.ragpipeline.service.rag.embedding;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns texts into embedding vectors through the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Inputs longer than the configured character limit are rejected rather than truncated, and a
 * missing or malformed vector is reported as an {@link EmbeddingException}; a zero vector is never
 * substituted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a single text.
   *
   * @param text the text to embed
   * @return embedding vector
   * @throws EmbeddingException if the text is unusable or the model call fails
   */
  @Timed(value = "embedding.embed", description = "Time to embed text")
  @Retry(name = "embedding", fallbackMethod = "embedFallback")
  public List<Float> embed(String text) {
    validate(text, 0);
    log.debug("Embedding text of {} chars", text.length());
    Response<Embedding> response;
    try {
      response = embeddingModel.embed(text);
    } catch (RuntimeException e) {
      throw new EmbeddingException("Embedding model call failed: " + e.getMessage(), e);
    }
    List<Float> vector = toVector(response.content(), 0);
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return vector;
  }

  /**
   * Embeds several texts, batching calls to the model.
   *
   * <p>Results are in input order and equal to calling {@link #embed(String)} for each text.
   *
   * @param texts the texts to embed
   * @return one vector per input text
   * @throws EmbeddingException if any text is unusable or any model call fails
   */
  @Timed(value = "embedding.embedAll", description = "Time to embed a batch of texts")
  @Retry(name = "embedding", fallbackMethod = "embedAllFallback")
  public List<List<Float>> embedAll(List<String> texts) {
    for (int i = 0; i < texts.size(); i++) {
      validate(texts.get(i), i);
    }
    int batchSize = ragConfig.getEmbedding().getBatchSize();
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
      List<TextSegment> segments = batch.stream().map(TextSegment::from).toList();
      Response<List<Embedding>> response;
      try {
        response = embeddingModel.embedAll(segments);
      } catch (RuntimeException e) {
        throw new EmbeddingException("Embedding model batch call failed: " + e.getMessage(), e);
      }
      List<Embedding> embeddings = response.content();
      if (embeddings == null || embeddings.size() != batch.size()) {
        throw new EmbeddingException(
            String.format(
                "Embedding model returned %d vectors for %d texts",
                embeddings == null ? 0 : embeddings.size(), batch.size()));
      }
      for (int i = 0; i < embeddings.size(); i++) {
        vectors.add(toVector(embeddings.get(i), from + i));
      }
      log.debug("Embedded batch of {} texts starting at {}", batch.size(), from);
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return vectors;
  }

  private void validate(String text, int index) {
    if (text == null || text.isBlank()) {
      throw new EmbeddingException("Text " + index + " is blank and cannot be embedded");
    }
    int limit = ragConfig.getEmbedding().getMaxInputChars();
    if (text.length() > limit) {
      throw new EmbeddingException(
          String.format(
              "Text %d has %d characters, above the embedding input limit of %d",
              index, text.length(), limit));
    }
  }

  private List<Float> toVector(Embedding embedding, int index) {
    if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
      throw new EmbeddingException("Embedding model returned an empty vector for text " + index);
    }
    float[] raw = embedding.vector();
    int expected = ragConfig.getEmbedding().getDimensions();
    if (expected > 0 && raw.length != expected) {
      throw new EmbeddingException(
          String.format(
              "Embedding for text %d has %d dimensions, expected %d", index, raw.length, expected));
    }
    List<Float> vector = new ArrayList<>(raw.length);
    for (float f : raw) {
      vector.add(f);
    }
    return List.copyOf(vector);
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    meterRegistry.counter("embedding.requests.failure", "type", "single").increment();
    throw asEmbeddingException(t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedAllFallback(List<String> texts, Throwable t) {
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    throw asEmbeddingException(t);
  }

  private static EmbeddingException asEmbeddingException(Throwable t) {
    log.error("Embedding failed after retries: {}", t.getMessage());
    if (t instanceof EmbeddingException e) {
      return e;
    }
    return new EmbeddingException("Embedding failed: " + t.getMessage(), t);
  }
}
