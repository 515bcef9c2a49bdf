package com.flamingo.ai.ragpipeline.config;

import com.flamingo.ai.ragpipeline.service.rag.answer.LanguageModelClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for metrics and resilience event logging. */
@Configuration
@Slf4j
public class ObservabilityConfig {

  static final String ELASTICSEARCH = "elasticsearch";
  static final String EMBEDDING = "embedding";

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public CircuitBreaker elasticsearchCircuitBreaker(CircuitBreakerRegistry registry) {
    CircuitBreaker circuitBreaker = registry.circuitBreaker(ELASTICSEARCH);
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                log.warn(
                    "Elasticsearch circuit breaker {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
        .onCallNotPermitted(event -> log.warn("Elasticsearch circuit breaker open, call rejected"));
    return circuitBreaker;
  }

  @Bean
  public Retry embeddingRetry(RetryRegistry registry) {
    Retry retry = registry.retry(EMBEDDING);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying embedding call, attempt {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable().getMessage()))
        .onError(
            event ->
                log.error(
                    "Embedding call failed after {} attempts", event.getNumberOfRetryAttempts()));
    return retry;
  }

  @Bean
  public TimeLimiter llmTimeLimiter(TimeLimiterRegistry registry) {
    TimeLimiter timeLimiter = registry.timeLimiter(LanguageModelClient.TIME_LIMITER);
    timeLimiter
        .getEventPublisher()
        .onTimeout(
            event ->
                log.warn(
                    "Language model call exceeded {}",
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration()));
    return timeLimiter;
  }
}
