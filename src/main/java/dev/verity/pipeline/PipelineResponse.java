package dev.verity.pipeline;

import dev.verity.decision.Decision;
import dev.verity.scoring.ReasonCode;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link QueryPipeline#runPipeline}.
 *
 * @param answer the answer text, with a caveat appended on clarify; null on abstain
 * @param citations chunk ids the answer cites, in evidence order; empty on abstain
 * @param confidence CONF in [0, 1]; 0 when the run abstained before generation
 * @param decision answer, clarify or abstain
 * @param reasons every reason that fired, in pipeline order
 * @param debug intermediate reports
 */
public record PipelineResponse(
    @Nullable String answer,
    List<String> citations,
    double confidence,
    Decision decision,
    List<ReasonCode> reasons,
    PipelineDebug debug) {

  public PipelineResponse {
    citations = List.copyOf(citations);
    reasons = List.copyOf(reasons);
  }
}
