package dev.verity.verification;

import dev.verity.scoring.ReasonCode;
import java.util.Optional;

/**
 * Score and verdict of one verification check.
 *
 * @param kind which check
 * @param score the check's score in [0, 1]; the configured default when {@code defaulted}
 * @param verdict {@link CheckVerdict#WARN} if the score crossed its threshold or was defaulted
 * @param defaulted true when the check failed or timed out
 */
public record CheckResult(CheckKind kind, double score, CheckVerdict verdict, boolean defaulted) {

  /** The reason this check contributes to the response, if any. */
  public Optional<ReasonCode> reason() {
    if (defaulted) {
      return Optional.of(kind.unavailableReason());
    }
    if (verdict == CheckVerdict.WARN) {
      return Optional.of(kind.warnReason());
    }
    return Optional.empty();
  }
}
