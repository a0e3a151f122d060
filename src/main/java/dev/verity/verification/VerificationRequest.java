package dev.verity.verification;

import dev.verity.config.Mode;
import dev.verity.generation.Evidence;
import java.util.List;
import java.util.Set;

/**
 * Input shared by the verification checks.
 *
 * @param question the normalized user question
 * @param answer the generated answer
 * @param evidence the numbered evidence the answer was generated from
 * @param citedPassages 1-based evidence numbers the answer cites
 * @param mode the query's mode
 */
public record VerificationRequest(
    String question,
    String answer,
    List<Evidence> evidence,
    Set<Integer> citedPassages,
    Mode mode) {

  public VerificationRequest {
    evidence = List.copyOf(evidence);
    citedPassages = Set.copyOf(citedPassages);
  }
}
