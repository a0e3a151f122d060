package dev.verity.decision;

import dev.verity.scoring.ReasonCode;
import java.util.List;

/**
 * Terminal confidence artifact of a query.
 *
 * @param confidence CONF, clamped to [0, 1]
 * @param decision the resolved decision
 * @param reasons every reason that fired, in rule order
 */
public record ConfidenceReport(double confidence, Decision decision, List<ReasonCode> reasons) {

  public ConfidenceReport {
    reasons = List.copyOf(reasons);
  }
}
