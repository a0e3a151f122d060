package dev.verity.verification;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.verity.scoring.ReasonCode;
import java.util.Locale;

/** The three independent verification checks run on a generated answer. */
public enum CheckKind {
  GROUNDEDNESS(ReasonCode.LOW_GROUNDEDNESS, ReasonCode.GROUNDEDNESS_UNAVAILABLE),
  CONTRADICTION(ReasonCode.HIGH_CONTRADICTION, ReasonCode.CONTRADICTION_UNAVAILABLE),
  SELF_CONSISTENCY(ReasonCode.SELF_INCONSISTENCY, ReasonCode.SELF_CONSISTENCY_UNAVAILABLE);

  private final ReasonCode warnReason;
  private final ReasonCode unavailableReason;

  CheckKind(ReasonCode warnReason, ReasonCode unavailableReason) {
    this.warnReason = warnReason;
    this.unavailableReason = unavailableReason;
  }

  /** Reason reported when the check's score crosses its warn threshold. */
  public ReasonCode warnReason() {
    return warnReason;
  }

  /** Reason reported when the check failed or timed out and its default was used. */
  public ReasonCode unavailableReason() {
    return unavailableReason;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
