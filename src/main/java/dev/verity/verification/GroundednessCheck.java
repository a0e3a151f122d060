package dev.verity.verification;

import dev.verity.config.PipelineProperties;
import dev.verity.generation.Evidence;
import dev.verity.generation.Generator;
import dev.verity.generation.Judgment;
import dev.verity.scoring.Scores;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Query-aware groundedness: the judge sees the question as well as the answer and evidence, so an
 * answer that is topically adjacent but not responsive scores low. A judge that reports the answer
 * declining to answer raises {@link FlagKind#SELF_ADMITTED_IGNORANCE}.
 */
@Component
public class GroundednessCheck implements VerificationCheck {

  private static final Logger log = LoggerFactory.getLogger(GroundednessCheck.class);

  private final Generator generator;
  private final int maxEvidence;

  public GroundednessCheck(Generator generator, PipelineProperties properties) {
    this.generator = generator;
    this.maxEvidence = properties.verification().maxEvidence();
  }

  @Override
  public CheckKind kind() {
    return CheckKind.GROUNDEDNESS;
  }

  @Override
  public CheckFinding evaluate(VerificationRequest request) {
    List<Evidence> evidence =
        request.evidence().subList(0, Math.min(maxEvidence, request.evidence().size()));
    Judgment judgment = generator.judge(request.question(), request.answer(), evidence);
    double score = Scores.clamp01(judgment.groundedness());
    if (!judgment.unsupportedClaims().isEmpty()) {
      log.debug("Unsupported claims: {}", judgment.unsupportedClaims());
    }
    return judgment.admitsIgnorance()
        ? new CheckFinding(score, Set.of(FlagKind.SELF_ADMITTED_IGNORANCE))
        : CheckFinding.of(score);
  }

  @Override
  public Duration timeout(PipelineProperties.Timeouts timeouts) {
    return timeouts.judgment();
  }

  @Override
  public double conservativeDefault(PipelineProperties.Verification verification) {
    return verification.defaultGroundedness();
  }

  @Override
  public boolean warns(double score, PipelineProperties.ModeSettings settings) {
    return score < settings.groundednessWarn();
  }
}
