package dev.verity.verification;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Per-check outcome against the mode's warn threshold. */
public enum CheckVerdict {
  PASS,
  WARN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
