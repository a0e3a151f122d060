package dev.verity.gate;

import dev.verity.concurrent.CallOutcome;
import dev.verity.concurrent.FanOut;
import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.generation.Generator;
import dev.verity.retrieval.CorpusStats;
import dev.verity.retrieval.RetrievalBreadth;
import dev.verity.retrieval.RetrievalOutcome;
import dev.verity.retrieval.RetrievalService;
import dev.verity.scoring.RetrievalQuality;
import dev.verity.scoring.RetrievalQualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes the one permitted retry for a query gated to fallback: rewrite the query, retrieve again
 * with widened breadth, and rescore.
 *
 * <p>The retry is the last chance. A post-retry {@code RQ >= T_low} proceeds even when it is still
 * below {@code T_high}; anything lower abstains. The controller never retries itself, and a
 * {@link FallbackBudget} rejects a second call for the same sub-question.
 */
@Service
public class FallbackController {

  private static final Logger log = LoggerFactory.getLogger(FallbackController.class);

  private final Generator generator;
  private final RetrievalService retrievalService;
  private final RetrievalQualityScorer scorer;
  private final CorpusStats corpusStats;
  private final FanOut fanOut;
  private final PipelineProperties properties;

  public FallbackController(
      Generator generator,
      RetrievalService retrievalService,
      RetrievalQualityScorer scorer,
      CorpusStats corpusStats,
      FanOut fanOut,
      PipelineProperties properties) {
    this.generator = generator;
    this.retrievalService = retrievalService;
    this.scorer = scorer;
    this.corpusStats = corpusStats;
    this.fanOut = fanOut;
    this.properties = properties;
  }

  /**
   * Runs the fallback retry.
   *
   * @param query the query that was gated to fallback
   * @param mode the query's mode
   * @param budget the sub-question's single-use permit
   * @return the post-retry retrieval and report
   * @throws IllegalStateException if {@code budget} was already spent
   */
  public FallbackResult retry(String query, Mode mode, FallbackBudget budget) {
    budget.consume();

    CallOutcome<String> rewrite =
        fanOut.call(
            "rewrite", () -> generator.rewrite(query), properties.timeouts().rewrite(), query);
    String rewritten = rewrite.value().isBlank() ? query : rewrite.value().strip();

    RetrievalBreadth breadth = RetrievalBreadth.widened(properties.retrieval());
    RetrievalOutcome retrieval = retrievalService.retrieve(rewritten, breadth);
    RetrievalQuality quality =
        scorer.score(retrieval.results(), breadth.topK(), corpusStats.distinctDocumentCount());

    GateTier tier =
        quality.rq() >= properties.forMode(mode).fallbackThreshold()
            ? GateTier.PROCEED
            : GateTier.ABSTAIN;
    log.info(
        "Fallback for '{}' retried as '{}': RQ={} -> {}",
        query,
        rewritten,
        String.format("%.3f", quality.rq()),
        tier.value());

    return new FallbackResult(
        rewritten, rewrite.defaulted(), retrieval, new RetrievalQualityReport(quality, tier));
  }
}
