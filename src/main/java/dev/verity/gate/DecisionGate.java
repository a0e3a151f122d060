package dev.verity.gate;

import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.scoring.RetrievalQuality;
import org.springframework.stereotype.Component;

/**
 * Routes a scored retrieval attempt: {@code RQ >= T_high} proceeds, {@code T_low <= RQ < T_high}
 * falls back, {@code RQ < T_low} abstains. Thresholds come from the query's mode.
 */
@Component
public class DecisionGate {

  private final PipelineProperties properties;

  public DecisionGate(PipelineProperties properties) {
    this.properties = properties;
  }

  public RetrievalQualityReport classify(RetrievalQuality quality, Mode mode) {
    PipelineProperties.ModeSettings settings = properties.forMode(mode);
    GateTier tier;
    if (quality.rq() >= settings.proceedThreshold()) {
      tier = GateTier.PROCEED;
    } else if (quality.rq() >= settings.fallbackThreshold()) {
      tier = GateTier.FALLBACK;
    } else {
      tier = GateTier.ABSTAIN;
    }
    return new RetrievalQualityReport(quality, tier);
  }
}
