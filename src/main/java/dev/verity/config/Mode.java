package dev.verity.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Answering mode selected per query. {@link #STRICT} uses uniformly higher thresholds at every
 * gate so that more queries resolve to clarify or abstain.
 */
public enum Mode {
  NORMAL("normal"),
  STRICT("strict");

  private final String value;

  Mode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a mode name case-insensitively. A null or blank value selects {@link #NORMAL}.
   *
   * @param raw the mode name ("normal" or "strict")
   * @return the parsed mode
   * @throws IllegalArgumentException if the value names no known mode
   */
  @JsonCreator
  public static Mode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return NORMAL;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (Mode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown mode: " + raw);
  }
}
