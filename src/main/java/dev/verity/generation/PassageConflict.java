package dev.verity.generation;

/**
 * Two evidence passages that state conflicting facts. Passage numbers are 1-based positions in
 * the evidence list.
 */
public record PassageConflict(int passageA, int passageB, String description) {

  public PassageConflict {
    if (passageA < 1 || passageB < 1) {
      throw new IllegalArgumentException(
          "Passage numbers are 1-based, got: " + passageA + ", " + passageB);
    }
    description = description == null ? "" : description;
  }

  /** True if either side of the conflict is the given passage. */
  public boolean involves(int passage) {
    return passageA == passage || passageB == passage;
  }
}
