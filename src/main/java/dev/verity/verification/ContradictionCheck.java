package dev.verity.verification;

import dev.verity.config.PipelineProperties;
import dev.verity.generation.ConflictAssessment;
import dev.verity.generation.ContradictionJudge;
import dev.verity.generation.PassageConflict;
import dev.verity.scoring.Scores;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Pairwise evidence-vs-evidence conflicts plus answer-vs-evidence conflicts.
 *
 * <p>The rate is the larger of the conflicting-pair share ({@code conflicting pairs / C(n, 2)} over
 * the {@code n} compared passages) and the judge's answer conflict rate. A conflicting pair that
 * involves a passage the answer cites raises {@link FlagKind#EVIDENCE_CONFLICT}.
 */
@Component
public class ContradictionCheck implements VerificationCheck {

  private final ContradictionJudge judge;
  private final int maxPassages;

  public ContradictionCheck(ContradictionJudge judge, PipelineProperties properties) {
    this.judge = judge;
    this.maxPassages = properties.verification().maxConflictPassages();
  }

  @Override
  public CheckKind kind() {
    return CheckKind.CONTRADICTION;
  }

  @Override
  public CheckFinding evaluate(VerificationRequest request) {
    ConflictAssessment assessment = judge.assess(request.answer(), request.evidence(), maxPassages);
    int compared = Math.min(assessment.passagesCompared(), request.evidence().size());
    double pairRate = pairRate(assessment.passageConflicts(), compared);
    double rate = Scores.clamp01(Math.max(pairRate, assessment.answerConflictRate()));

    for (PassageConflict conflict : assessment.passageConflicts()) {
      for (int cited : request.citedPassages()) {
        if (conflict.involves(cited)) {
          return new CheckFinding(rate, Set.of(FlagKind.EVIDENCE_CONFLICT));
        }
      }
    }
    return CheckFinding.of(rate);
  }

  static double pairRate(List<PassageConflict> conflicts, int compared) {
    int pairs = compared * (compared - 1) / 2;
    if (pairs <= 0) {
      return 0.0;
    }
    Set<Long> distinct = new HashSet<>();
    for (PassageConflict conflict : conflicts) {
      int a = Math.min(conflict.passageA(), conflict.passageB());
      int b = Math.max(conflict.passageA(), conflict.passageB());
      if (a != b && b <= compared) {
        distinct.add(((long) a << 32) | b);
      }
    }
    return Scores.clamp01((double) distinct.size() / pairs);
  }

  @Override
  public Duration timeout(PipelineProperties.Timeouts timeouts) {
    return timeouts.judgment();
  }

  @Override
  public double conservativeDefault(PipelineProperties.Verification verification) {
    return verification.defaultContradictionRate();
  }

  @Override
  public boolean warns(double score, PipelineProperties.ModeSettings settings) {
    return score > settings.contradictionWarn();
  }
}
