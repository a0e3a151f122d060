package dev.verity.gate;

/**
 * Single-use permit for the fallback retry of one query or sub-question. Not thread-safe; each
 * sub-question owns its own budget.
 */
public final class FallbackBudget {

  private final String owner;
  private boolean spent;

  public FallbackBudget(String owner) {
    this.owner = owner;
  }

  /**
   * Consumes the permit.
   *
   * @throws IllegalStateException if the permit was already consumed
   */
  void consume() {
    if (spent) {
      throw new IllegalStateException("Fallback already used for: " + owner);
    }
    spent = true;
  }

  public boolean spent() {
    return spent;
  }
}
