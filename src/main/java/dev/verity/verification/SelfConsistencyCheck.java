package dev.verity.verification;

import dev.verity.config.PipelineProperties;
import dev.verity.generation.Generator;
import java.time.Duration;
import org.springframework.stereotype.Component;

/** Regenerates the answer from the same evidence and scores agreement with the original. */
@Component
public class SelfConsistencyCheck implements VerificationCheck {

  private final Generator generator;

  public SelfConsistencyCheck(Generator generator) {
    this.generator = generator;
  }

  @Override
  public CheckKind kind() {
    return CheckKind.SELF_CONSISTENCY;
  }

  @Override
  public CheckFinding evaluate(VerificationRequest request) {
    String second = generator.regenerate(request.question(), request.evidence(), request.mode());
    return CheckFinding.of(TextSimilarity.ratio(request.answer(), second));
  }

  @Override
  public Duration timeout(PipelineProperties.Timeouts timeouts) {
    return timeouts.generation();
  }

  @Override
  public double conservativeDefault(PipelineProperties.Verification verification) {
    return verification.defaultSelfConsistency();
  }

  @Override
  public boolean warns(double score, PipelineProperties.ModeSettings settings) {
    return score < settings.selfConsistencyWarn();
  }
}
