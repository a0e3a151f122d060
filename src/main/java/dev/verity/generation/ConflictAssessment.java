package dev.verity.generation;

import java.util.List;

/**
 * Output of a contradiction judgment.
 *
 * @param passagesCompared how many leading evidence passages were compared pairwise
 * @param passageConflicts conflicting passage pairs among those compared
 * @param answerConflictRate share of the answer's claims that contradict the evidence, in [0, 1]
 */
public record ConflictAssessment(
    int passagesCompared, List<PassageConflict> passageConflicts, double answerConflictRate) {

  public ConflictAssessment {
    if (!Double.isFinite(answerConflictRate)) {
      throw new IllegalArgumentException(
          "answerConflictRate must be finite: " + answerConflictRate);
    }
    passageConflicts = List.copyOf(passageConflicts);
  }
}
