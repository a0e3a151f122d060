package dev.verity.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScoresTest {

  @Test
  void clampsToUnitInterval() {
    assertThat(Scores.clamp01(-0.2)).isZero();
    assertThat(Scores.clamp01(0.42)).isEqualTo(0.42);
    assertThat(Scores.clamp01(1.7)).isEqualTo(1.0);
  }

  @Test
  void nanClampsToZero() {
    assertThat(Scores.clamp01(Double.NaN)).isZero();
  }

  @Test
  void reasonCodesSerializeAsLowercase() {
    assertThat(ReasonCode.LOW_RETRIEVAL_QUALITY_AFTER_FALLBACK.code())
        .isEqualTo("low_retrieval_quality_after_fallback");
  }
}
