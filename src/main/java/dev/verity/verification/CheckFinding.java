package dev.verity.verification;

import java.util.Set;

/** Raw result of one check before the aggregator applies thresholds. */
public record CheckFinding(double score, Set<FlagKind> flags) {

  public CheckFinding {
    flags = Set.copyOf(flags);
  }

  public static CheckFinding of(double score) {
    return new CheckFinding(score, Set.of());
  }
}
