package dev.verity.scoring;

import java.util.List;

/**
 * Composite retrieval quality of one retrieval attempt. All values lie in [0, 1].
 *
 * @param relevance normalized score of the rank-1 result
 * @param margin gap between the first and second normalized scores
 * @param coverage share of distinct source documents among the top results
 * @param consistency inverse spread of the top-5 normalized scores
 * @param rq weighted sum of the four sub-signals
 * @param diagnostics sub-signals that fell below their diagnostic floor
 */
public record RetrievalQuality(
    double relevance,
    double margin,
    double coverage,
    double consistency,
    double rq,
    List<ReasonCode> diagnostics) {

  public RetrievalQuality {
    diagnostics = List.copyOf(diagnostics);
  }
}
