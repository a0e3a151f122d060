package dev.verity.decision;

import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.scoring.ConfidenceScorer;
import dev.verity.scoring.ReasonCode;
import dev.verity.verification.FlagKind;
import dev.verity.verification.VerificationSignals;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves confidence and the final decision through an ordered rule cascade. The first rule that
 * fires decides; every rule that fires contributes its reasons.
 *
 * <ol>
 *   <li>evidence conflict flag, or contradiction rate above the ceiling: abstain
 *   <li>self-admitted ignorance with {@code RQ >= T_high}: clarify
 *   <li>self-admitted ignorance with {@code RQ < T_high}: abstain
 *   <li>any verification check at warn level: clarify
 *   <li>{@code CONF >= clarify_high}: answer
 *   <li>{@code clarify_low <= CONF < clarify_high}: clarify
 *   <li>{@code CONF < clarify_low}: abstain
 * </ol>
 */
@Component
public class FinalDecisionPolicy {

  private static final Logger log = LoggerFactory.getLogger(FinalDecisionPolicy.class);

  static final List<DecisionRule> RULES =
      List.of(
          input ->
              input.signals().has(FlagKind.EVIDENCE_CONFLICT)
                      || input.signals().contradictionRate()
                          > input.settings().contradictionCeiling()
                  ? Optional.of(
                      DecisionRule.Fired.of(Decision.ABSTAIN, ReasonCode.CONTRADICTION_DETECTED))
                  : Optional.empty(),
          input ->
              input.signals().has(FlagKind.SELF_ADMITTED_IGNORANCE)
                      && input.rq() >= input.settings().proceedThreshold()
                  ? Optional.of(
                      DecisionRule.Fired.of(Decision.CLARIFY, ReasonCode.SELF_ADMITTED_IGNORANCE))
                  : Optional.empty(),
          input ->
              input.signals().has(FlagKind.SELF_ADMITTED_IGNORANCE)
                      && input.rq() < input.settings().proceedThreshold()
                  ? Optional.of(
                      DecisionRule.Fired.of(Decision.ABSTAIN, ReasonCode.SELF_ADMITTED_IGNORANCE))
                  : Optional.empty(),
          input ->
              input.signals().anyWarning()
                  ? Optional.of(
                      new DecisionRule.Fired(Decision.CLARIFY, input.signals().checkReasons()))
                  : Optional.empty(),
          input ->
              input.confidence() >= input.settings().clarifyHigh()
                  ? Optional.of(DecisionRule.Fired.of(Decision.ANSWER, ReasonCode.CONFIDENCE_HIGH))
                  : Optional.empty(),
          input ->
              input.confidence() >= input.settings().clarifyLow()
                      && input.confidence() < input.settings().clarifyHigh()
                  ? Optional.of(
                      DecisionRule.Fired.of(Decision.CLARIFY, ReasonCode.CONFIDENCE_MODERATE))
                  : Optional.empty(),
          input ->
              input.confidence() < input.settings().clarifyLow()
                  ? Optional.of(DecisionRule.Fired.of(Decision.ABSTAIN, ReasonCode.CONFIDENCE_LOW))
                  : Optional.empty());

  private final PipelineProperties properties;

  public FinalDecisionPolicy(PipelineProperties properties) {
    this.properties = properties;
  }

  /**
   * Scores confidence and resolves the decision.
   *
   * @param rq the effective retrieval quality
   * @param signals verification of the answer
   * @param mode the query's mode
   * @return the confidence report
   */
  public ConfidenceReport decide(double rq, VerificationSignals signals, Mode mode) {
    PipelineProperties.ModeSettings settings = properties.forMode(mode);
    double confidence =
        ConfidenceScorer.score(rq, signals.groundedness(), signals.contradictionRate(), settings);
    DecisionInput input = new DecisionInput(rq, signals, confidence, settings);

    Decision decision = null;
    List<ReasonCode> reasons = new ArrayList<>();
    for (DecisionRule rule : RULES) {
      Optional<DecisionRule.Fired> fired = rule.evaluate(input);
      if (fired.isEmpty()) {
        continue;
      }
      if (decision == null) {
        decision = fired.get().decision();
      }
      for (ReasonCode reason : fired.get().reasons()) {
        if (!reasons.contains(reason)) {
          reasons.add(reason);
        }
      }
    }
    if (decision == null) {
      // rules 5-7 partition [0, 1]
      throw new IllegalStateException("No decision rule fired for confidence " + confidence);
    }

    log.info(
        "Decision {} at confidence {} ({})",
        decision.value(),
        String.format("%.3f", confidence),
        reasons);
    return new ConfidenceReport(confidence, decision, reasons);
  }
}
