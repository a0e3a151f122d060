package dev.verity.gate;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import dev.verity.scoring.ReasonCode;
import dev.verity.scoring.RetrievalQuality;
import java.util.List;

/**
 * Retrieval quality of one attempt together with the tier the gate assigned it.
 *
 * <p>After a fallback the post-retry report replaces the initial one for every downstream stage;
 * the initial report is kept for diagnostics only.
 */
public record RetrievalQualityReport(@JsonUnwrapped RetrievalQuality quality, GateTier tier) {

  public double rq() {
    return quality.rq();
  }

  public List<ReasonCode> diagnostics() {
    return quality.diagnostics();
  }
}
