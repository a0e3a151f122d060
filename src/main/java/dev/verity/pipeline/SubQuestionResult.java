package dev.verity.pipeline;

import dev.verity.gate.RetrievalQualityReport;
import dev.verity.retrieval.RetrievalOutcome;
import dev.verity.scoring.ReasonCode;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Gated retrieval of one sub-question.
 *
 * @param question the sub-question
 * @param initialReport report of the first attempt
 * @param fallbackReport report of the fallback retry; null if none ran
 * @param rewrittenQuery the query the fallback retried with; null if none ran
 * @param retrieval the attempt whose results feed generation
 * @param proceeds true if generation may use this sub-question's evidence
 * @param reasons reasons contributed by this sub-question
 */
record SubQuestionResult(
    String question,
    RetrievalQualityReport initialReport,
    @Nullable RetrievalQualityReport fallbackReport,
    @Nullable String rewrittenQuery,
    RetrievalOutcome retrieval,
    boolean proceeds,
    List<ReasonCode> reasons) {

  SubQuestionResult {
    reasons = List.copyOf(reasons);
  }

  boolean fallbackTriggered() {
    return fallbackReport != null;
  }

  /** The report downstream stages score with: post-fallback when a fallback ran. */
  RetrievalQualityReport effectiveReport() {
    return fallbackReport != null ? fallbackReport : initialReport;
  }

  SubQuestionTrace trace() {
    return new SubQuestionTrace(question, initialReport, fallbackReport, rewrittenQuery);
  }
}
