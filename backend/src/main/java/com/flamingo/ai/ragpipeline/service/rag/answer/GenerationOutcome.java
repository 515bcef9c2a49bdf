package com.flamingo.ai.ragpipeline.service.rag.answer;

/**
 * Result of one bounded attempt to generate text: either the generated text or a short tag naming
 * why the caller has to fall back ({@code timeout}, {@code error}, {@code empty_response}, {@code
 * interrupted}).
 */
public record GenerationOutcome(String text, String fallbackReason) {

  public static GenerationOutcome generated(String text) {
    return new GenerationOutcome(text, null);
  }

  public static GenerationOutcome fallback(String reason) {
    return new GenerationOutcome(null, reason);
  }

  public boolean isGenerated() {
    return fallbackReason == null;
  }
}
