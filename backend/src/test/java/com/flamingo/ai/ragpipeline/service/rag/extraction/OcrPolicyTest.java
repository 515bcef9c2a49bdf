package com.flamingo.ai.ragpipeline.service.rag.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OcrPolicy Tests")
class OcrPolicyTest {

  @Test
  @DisplayName("Should require OCR strictly below the threshold")
  void shouldRequireOcrBelowThreshold() {
    OcrPolicy policy = new OcrPolicy(50);

    assertThat(policy.needsOcr(0)).isTrue();
    assertThat(policy.needsOcr(49)).isTrue();
    assertThat(policy.needsOcr(50)).isFalse();
    assertThat(policy.needsOcr(500)).isFalse();
  }

  @Test
  @DisplayName("Should read the threshold from configuration")
  void shouldReadConfiguredThreshold() {
    RagConfig config = new RagConfig();
    config.getExtraction().setOcrThreshold(10);

    OcrPolicy policy = new OcrPolicy(config);

    assertThat(policy.getThreshold()).isEqualTo(10);
    assertThat(policy.needsOcr(9)).isTrue();
    assertThat(policy.needsOcr(10)).isFalse();
  }

  @Test
  @DisplayName("Should default to a threshold of 50")
  void shouldDefaultToFifty() {
    assertThat(new OcrPolicy(new RagConfig()).getThreshold()).isEqualTo(50);
  }

  @Test
  @DisplayName("Should reject a non-positive threshold")
  void shouldRejectNonPositiveThreshold() {
    assertThatThrownBy(() -> new OcrPolicy(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
