package dev.verity.gate;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Pre-generation routing decision. */
public enum GateTier {
  /** Generate directly. */
  PROCEED,
  /** Retry retrieval once with a rewritten query and widened breadth. */
  FALLBACK,
  /** Do not generate. */
  ABSTAIN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
