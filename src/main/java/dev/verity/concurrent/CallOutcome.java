package dev.verity.concurrent;

import org.jspecify.annotations.Nullable;

/**
 * Result of one fanned-out external call: either the collaborator's value, or the conservative
 * default that replaced it together with the failure that caused the substitution.
 *
 * @param name the call name used in logs and reason codes
 * @param value the collaborator's value, or the default when {@code failure} is set
 * @param failure the failure that forced the default; null when the call completed
 * @param <T> value type
 */
public record CallOutcome<T>(String name, T value, @Nullable ExternalCallException failure) {

  static <T> CallOutcome<T> ofValue(String name, T value) {
    return new CallOutcome<>(name, value, null);
  }

  static <T> CallOutcome<T> ofDefault(String name, T fallback, ExternalCallException failure) {
    return new CallOutcome<>(name, fallback, failure);
  }

  /** True if the value is the conservative default rather than the collaborator's answer. */
  public boolean defaulted() {
    return failure != null;
  }

  /** True if the default was substituted because the call timed out. */
  public boolean timedOut() {
    return failure instanceof ExternalCallTimeoutException;
  }
}
