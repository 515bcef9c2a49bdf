package com.flamingo.ai.ragpipeline.config;

import com.flamingo.ai.ragpipeline.service.rag.retrieval.SearchMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the ingestion and answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Validated
@Getter
@Setter
public class RagConfig {

  @Valid private Extraction extraction = new Extraction();
  @Valid private Chunking chunking = new Chunking();
  @Valid private Embedding embedding = new Embedding();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Answer answer = new Answer();
  @Valid private Ingestion ingestion = new Ingestion();
  @Valid private Cache cache = new Cache();

  @Getter
  @Setter
  public static class Extraction {
    /** Pages with fewer native characters than this are sent to OCR. */
    @Positive private int ocrThreshold = 50;

    /** Linear scale used when rasterizing a page for OCR. */
    @Positive private float renderScale = 2.0f;

    @NotBlank private String ocrLanguage = "eng";
    @NotBlank private String ocrPageSegMode = "6";
    @Positive private int ocrTimeoutSeconds = 120;
  }

  @Getter
  @Setter
  public static class Chunking {
    @Positive private int size = 300;
    @PositiveOrZero private int overlap = 50;

    /** Hard ceiling; no chunk is ever emitted above this many tokens. */
    @Positive private int maxTokens = 512;

    /**
     * Fraction of {@code size} a sentence or paragraph break may fall short of the hard cut and
     * still be preferred.
     */
    @PositiveOrZero
    @DecimalMax("1.0")
    private double boundaryTolerance = 0.2;

    /** Model whose tokenizer is used for counting (cl100k family). */
    @NotBlank private String tokenizerModel = "gpt-4";
  }

  @Getter
  @Setter
  public static class Embedding {
    @Positive private int batchSize = 32;
    @Positive private int maxInputChars = 8000;

    /** Expected vector length; 0 disables the check. */
    @PositiveOrZero private int dimensions = 1536;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @Positive private int topK = 5;
    @Positive private int rrfK = 60;
    @Positive private int candidatesMultiplier = 3;
    @Positive private int maxCandidates = 50;
    private SearchMode defaultMode = SearchMode.HYBRID;
  }

  @Getter
  @Setter
  public static class Answer {
    @Positive private int maxContextTokens = 2000;
    @Positive private int maxContextChunks = 5;
  }

  @Getter
  @Setter
  public static class Ingestion {
    @Positive private int corePoolSize = 2;
    @Positive private int maxPoolSize = 4;
    @PositiveOrZero private int queueCapacity = 100;
  }

  @Getter
  @Setter
  public static class Cache {
    private boolean enabled = false;
    @NotBlank private String directory = "cache/extractions";
  }
}
