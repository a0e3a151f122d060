package dev.verity.pipeline;

import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.gate.DecisionGate;
import dev.verity.gate.FallbackBudget;
import dev.verity.gate.FallbackController;
import dev.verity.gate.FallbackResult;
import dev.verity.gate.GateTier;
import dev.verity.gate.RetrievalQualityReport;
import dev.verity.retrieval.CorpusStats;
import dev.verity.retrieval.RetrievalBreadth;
import dev.verity.retrieval.RetrievalOutcome;
import dev.verity.retrieval.RetrievalService;
import dev.verity.scoring.ReasonCode;
import dev.verity.scoring.RetrievalQualityScorer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Retrieval, scoring and gating for one sub-question, including its single permitted fallback.
 */
@Component
class SubQuestionRetriever {

  private static final Logger log = LoggerFactory.getLogger(SubQuestionRetriever.class);

  private final RetrievalService retrievalService;
  private final RetrievalQualityScorer scorer;
  private final DecisionGate gate;
  private final FallbackController fallbackController;
  private final CorpusStats corpusStats;
  private final PipelineProperties properties;

  SubQuestionRetriever(
      RetrievalService retrievalService,
      RetrievalQualityScorer scorer,
      DecisionGate gate,
      FallbackController fallbackController,
      CorpusStats corpusStats,
      PipelineProperties properties) {
    this.retrievalService = retrievalService;
    this.scorer = scorer;
    this.gate = gate;
    this.fallbackController = fallbackController;
    this.corpusStats = corpusStats;
    this.properties = properties;
  }

  SubQuestionResult retrieve(String question, Mode mode) {
    RetrievalBreadth breadth = RetrievalBreadth.initial(properties.retrieval());
    RetrievalOutcome outcome = retrievalService.retrieve(question, breadth);
    RetrievalQualityReport initial =
        gate.classify(
            scorer.score(outcome.results(), breadth.topK(), corpusStats.distinctDocumentCount()),
            mode);
    log.info(
        "Gate for '{}': RQ={} -> {}",
        question,
        String.format("%.3f", initial.rq()),
        initial.tier().value());

    List<ReasonCode> reasons = new ArrayList<>();
    if (outcome.unavailable()) {
      reasons.add(ReasonCode.NO_EVIDENCE);
      reasons.addAll(initial.diagnostics());
      return new SubQuestionResult(question, initial, null, null, outcome, false, reasons);
    }

    if (initial.tier() == GateTier.PROCEED) {
      reasons.addAll(initial.diagnostics());
      return new SubQuestionResult(question, initial, null, null, outcome, true, reasons);
    }
    if (initial.tier() == GateTier.ABSTAIN) {
      reasons.add(ReasonCode.LOW_RETRIEVAL_QUALITY);
      reasons.addAll(initial.diagnostics());
      return new SubQuestionResult(question, initial, null, null, outcome, false, reasons);
    }

    FallbackResult fallback =
        fallbackController.retry(question, mode, new FallbackBudget(question));
    reasons.add(ReasonCode.FALLBACK_USED);
    if (fallback.retrieval().unavailable()) {
      reasons.add(ReasonCode.NO_EVIDENCE);
    }
    if (!fallback.proceeds()) {
      reasons.add(ReasonCode.LOW_RETRIEVAL_QUALITY_AFTER_FALLBACK);
    }
    reasons.addAll(fallback.report().diagnostics());
    return new SubQuestionResult(
        question,
        initial,
        fallback.report(),
        fallback.rewrittenQuery(),
        fallback.retrieval(),
        fallback.proceeds(),
        reasons);
  }
}
