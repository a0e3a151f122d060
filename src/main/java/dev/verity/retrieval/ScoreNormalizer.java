package dev.verity.retrieval;

/**
 * Maps unbounded reranker scores onto [0, 1] with the logistic function {@code 1 / (1 + e^-raw)},
 * so downstream arithmetic is independent of whichever reranker is plugged in.
 */
public final class ScoreNormalizer {

  private ScoreNormalizer() {}

  /**
   * Normalizes a raw relevance score.
   *
   * @param raw the reranker's score; {@code NaN} marks a failed rerank call
   * @return the logistic of {@code raw}, or 0.0 for {@code NaN}
   */
  public static double normalize(double raw) {
    if (Double.isNaN(raw)) {
      return 0.0;
    }
    return 1.0 / (1.0 + Math.exp(-raw));
  }
}
