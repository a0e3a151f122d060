package dev.verity.scoring;

/** Arithmetic helpers shared by the scorers. */
public final class Scores {

  private Scores() {}

  /** Clamps to [0, 1]; NaN maps to 0. */
  public static double clamp01(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
