package com.flamingo.ai.ragpipeline.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for ingestion batches and language-model calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor(RagConfig ragConfig) {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingestion.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(ingestion.getCorePoolSize(), ingestion.getMaxPoolSize()));
    executor.setQueueCapacity(ingestion.getQueueCapacity());
    executor.setThreadNamePrefix("ingest-");
    // a full queue slows the submitting request down instead of failing documents
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  @Bean(name = "generationExecutor")
  public ThreadPoolTaskExecutor generationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("llm-");
    executor.initialize();
    return executor;
  }
}
