package dev.verity.gate;

import dev.verity.retrieval.RetrievalOutcome;

/**
 * Outcome of the single fallback retry.
 *
 * @param rewrittenQuery the query the retry retrieved with; the original query if rewriting failed
 * @param rewriteDefaulted true when the rewrite call failed or timed out
 * @param retrieval the widened retrieval attempt
 * @param report the post-retry report, tier {@link GateTier#PROCEED} or {@link GateTier#ABSTAIN}
 */
public record FallbackResult(
    String rewrittenQuery,
    boolean rewriteDefaulted,
    RetrievalOutcome retrieval,
    RetrievalQualityReport report) {

  public boolean proceeds() {
    return report.tier() == GateTier.PROCEED;
  }
}
