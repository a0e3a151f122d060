package dev.verity.decision;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Final three-state outcome of a query. */
public enum Decision {
  ANSWER,
  /** The answer is returned with an explicit caveat. */
  CLARIFY,
  ABSTAIN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
