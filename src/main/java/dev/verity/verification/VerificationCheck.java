package dev.verity.verification;

import dev.verity.config.PipelineProperties;
import java.time.Duration;

/**
 * One independent verification check. The aggregator runs every check concurrently, bounds each
 * by {@link #timeout}, and replaces a failed or timed-out check with {@link #conservativeDefault}.
 */
public interface VerificationCheck {

  CheckKind kind();

  /**
   * Runs the check. May throw; the aggregator recovers.
   *
   * @return score in [0, 1] plus any flags raised
   */
  CheckFinding evaluate(VerificationRequest request);

  Duration timeout(PipelineProperties.Timeouts timeouts);

  /** Score used when the check fails or times out. */
  double conservativeDefault(PipelineProperties.Verification verification);

  /** True if the score is a warn-level outcome under the given mode settings. */
  boolean warns(double score, PipelineProperties.ModeSettings settings);
}
