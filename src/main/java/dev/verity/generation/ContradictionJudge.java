package dev.verity.generation;

import java.util.List;

/** Detects conflicts among evidence passages and between an answer and its evidence. */
public interface ContradictionJudge {

  /**
   * @param answer the generated answer
   * @param evidence passages to compare; implementations compare at most {@code maxPassages}
   *     leading passages pairwise
   * @param maxPassages cap on pairwise passage comparison
   */
  ConflictAssessment assess(String answer, List<Evidence> evidence, int maxPassages);
}
