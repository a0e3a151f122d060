package dev.verity.generation;

import dev.verity.config.Mode;
import java.util.List;

/**
 * Text generation capability consumed by the pipeline. Every method is invoked with an explicit
 * timeout by the caller and may throw; the caller substitutes a conservative value on failure.
 */
public interface Generator {

  /**
   * Answers the query from the numbered evidence, citing passages as {@code [n]}.
   *
   * @param mode {@link Mode#STRICT} asks for a more conservative answer
   */
  String answer(String query, List<Evidence> evidence, Mode mode);

  /**
   * Produces a second, independent answer from the same evidence for self-consistency.
   * Implementations should sample differently from {@link #answer}.
   */
  default String regenerate(String query, List<Evidence> evidence, Mode mode) {
    return answer(query, evidence, mode);
  }

  /** Rewrites a query that retrieved poorly into one more likely to match the corpus. */
  String rewrite(String query);

  /** Judges how well {@code answer} is grounded in {@code evidence} for {@code question}. */
  Judgment judge(String question, String answer, List<Evidence> evidence);
}
