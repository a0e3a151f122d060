package dev.verity.scoring;

import dev.verity.config.PipelineProperties;

/**
 * {@code CONF = clamp01(alpha * RQ + beta * groundedness - gamma * contradictionRate)}, with the
 * weights taken from the active mode.
 */
public final class ConfidenceScorer {

  private ConfidenceScorer() {}

  public static double score(
      double rq,
      double groundedness,
      double contradictionRate,
      PipelineProperties.ModeSettings settings) {
    return Scores.clamp01(
        settings.alpha() * rq
            + settings.beta() * groundedness
            - settings.gamma() * contradictionRate);
  }
}
