package dev.verity.verification;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Boolean verification findings that override the numeric confidence. */
public enum FlagKind {
  /** The answer itself says the evidence does not answer the question. */
  SELF_ADMITTED_IGNORANCE,
  /** Evidence passages the answer cites conflict with other evidence. */
  EVIDENCE_CONFLICT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
