package dev.verity.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Observable reason attached to a pipeline response. Serialized as the lowercase code, e.g.
 * {@code low_retrieval_quality_after_fallback}.
 */
public enum ReasonCode {
  // gate and retrieval
  NO_EVIDENCE,
  LOW_RETRIEVAL_QUALITY,
  LOW_RETRIEVAL_QUALITY_AFTER_FALLBACK,
  FALLBACK_USED,

  // retrieval quality diagnostics
  NO_RESULTS,
  LOW_RELEVANCE,
  LOW_MARGIN,
  LOW_COVERAGE,
  LOW_CONSISTENCY,

  // verification
  LOW_GROUNDEDNESS,
  HIGH_CONTRADICTION,
  SELF_INCONSISTENCY,
  GROUNDEDNESS_UNAVAILABLE,
  CONTRADICTION_UNAVAILABLE,
  SELF_CONSISTENCY_UNAVAILABLE,
  GENERATION_FAILED,

  // final decision
  CONTRADICTION_DETECTED,
  SELF_ADMITTED_IGNORANCE,
  CONFIDENCE_HIGH,
  CONFIDENCE_MODERATE,
  CONFIDENCE_LOW;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
