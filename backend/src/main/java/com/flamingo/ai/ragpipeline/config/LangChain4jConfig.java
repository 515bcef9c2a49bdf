package com.flamingo.ai.ragpipeline.config;

import com.flamingo.ai.ragpipeline.service.rag.chunking.TokenCounter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Any OpenAI-compatible endpoint can be used by setting {@code langchain4j.openai.base-url}; an
 * API key is only required for the public OpenAI endpoint.
 */
@Configuration
public class LangChain4jConfig {

  static final String OPENAI_BASE_URL = "https://api.openai.com/v1";
  private static final String LOCAL_API_KEY = "not-needed";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:" + OPENAI_BASE_URL + "}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-tokens:512}")
  private int maxTokens;

  @Value("${langchain4j.openai.chat-model.temperature:0.3}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.top-p:0.9}")
  private double topP;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  public ChatModel chatModel() {
    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(resolveApiKey())
        .modelName(chatModelName)
        .maxTokens(maxTokens)
        .temperature(temperature)
        .topP(topP)
        // the llm time limiter owns the deadline; this only bounds the socket
        .timeout(Duration.ofSeconds(120))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    return OpenAiEmbeddingModel.builder()
        .baseUrl(baseUrl)
        .apiKey(resolveApiKey())
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  @Bean
  public TokenCounter tokenCounter(RagConfig ragConfig) {
    OpenAiTokenCountEstimator estimator =
        new OpenAiTokenCountEstimator(ragConfig.getChunking().getTokenizerModel());
    return estimator::estimateTokenCountInText;
  }

  private String resolveApiKey() {
    if (openAiApiKey != null && !openAiApiKey.isBlank()) {
      return openAiApiKey;
    }
    if (OPENAI_BASE_URL.equals(baseUrl)) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    return LOCAL_API_KEY;
  }
}
