package dev.verity.verification;

import dev.verity.scoring.ReasonCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Aggregated verification of one generated answer.
 *
 * @param groundedness support of the answer's claims by the evidence, in [0, 1]
 * @param contradictionRate share of compared pairs and claims in conflict, in [0, 1]
 * @param selfConsistency agreement with an independently regenerated answer, in [0, 1]
 * @param flags override findings
 * @param checks the per-check results in {@link CheckKind} order
 */
public record VerificationSignals(
    double groundedness,
    double contradictionRate,
    double selfConsistency,
    Set<FlagKind> flags,
    List<CheckResult> checks) {

  public VerificationSignals {
    flags = Set.copyOf(flags);
    checks = List.copyOf(checks);
  }

  public boolean has(FlagKind flag) {
    return flags.contains(flag);
  }

  /** True if any check reported a warn-level outcome. */
  public boolean anyWarning() {
    return checks.stream().anyMatch(check -> check.verdict() == CheckVerdict.WARN);
  }

  /** Reasons contributed by warn-level or defaulted checks, in check order. */
  public List<ReasonCode> checkReasons() {
    List<ReasonCode> reasons = new ArrayList<>();
    for (CheckResult check : checks) {
      check.reason().ifPresent(reasons::add);
    }
    return reasons;
  }
}
