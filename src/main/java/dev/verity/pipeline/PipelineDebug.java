package dev.verity.pipeline;

import dev.verity.verification.VerificationSignals;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Intermediate artifacts of one pipeline run, exposed for observability.
 *
 * @param traceId random identifier of the run
 * @param latencyMs wall-clock duration of the run
 * @param normalizedQuery the question after normalization
 * @param subQuestions per-sub-question retrieval reports
 * @param fallbackTriggered true if any sub-question ran its fallback
 * @param effectiveRq the retrieval quality confidence was scored with
 * @param topScores normalized scores of the evidence handed to generation
 * @param verification verification signals; null if no answer was generated
 */
public record PipelineDebug(
    String traceId,
    long latencyMs,
    String normalizedQuery,
    List<SubQuestionTrace> subQuestions,
    boolean fallbackTriggered,
    double effectiveRq,
    List<Double> topScores,
    @Nullable VerificationSignals verification) {

  public PipelineDebug {
    subQuestions = List.copyOf(subQuestions);
    topScores = List.copyOf(topScores);
  }
}
