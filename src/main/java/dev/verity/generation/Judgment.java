package dev.verity.generation;

import java.util.List;

/**
 * Groundedness verdict on a generated answer.
 *
 * @param groundedness how well the answer's claims are supported by the evidence, in [0, 1]
 * @param admitsIgnorance whether the judge found the answer declining to answer
 * @param unsupportedClaims claims the judge could not find in the evidence
 */
public record Judgment(
    double groundedness, boolean admitsIgnorance, List<String> unsupportedClaims) {

  public Judgment {
    unsupportedClaims = List.copyOf(unsupportedClaims);
  }
}
