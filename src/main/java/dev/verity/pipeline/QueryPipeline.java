package dev.verity.pipeline;

import dev.verity.concurrent.CallOutcome;
import dev.verity.concurrent.FanOut;
import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.decision.ConfidenceReport;
import dev.verity.decision.Decision;
import dev.verity.decision.FinalDecisionPolicy;
import dev.verity.generation.CitationExtractor;
import dev.verity.generation.Evidence;
import dev.verity.generation.Generator;
import dev.verity.generation.QueryDecomposer;
import dev.verity.retrieval.RankedResult;
import dev.verity.scoring.ReasonCode;
import dev.verity.verification.VerificationAggregator;
import dev.verity.verification.VerificationRequest;
import dev.verity.verification.VerificationSignals;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * The retrieval-to-decision pipeline.
 *
 * <p>normalize -> decompose -> per sub-question, concurrently: retrieve -> score -> gate
 * (-> fallback once) -> merge evidence -> generate -> verify concurrently -> confidence -> final
 * decision.
 *
 * <p>Every anticipated failure resolves to answer, clarify or abstain with a reason trail. A
 * sub-question that abstains makes the whole query abstain without generating.
 */
@Service
public class QueryPipeline {

  private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

  static final String CLARIFY_CAVEAT =
      "\n\nNote: This answer has moderate uncertainty. "
          + "Some claims may not be fully supported by the available evidence.";

  private static final Comparator<RankedResult> EVIDENCE_ORDER =
      Comparator.comparingDouble(RankedResult::normalizedScore)
          .reversed()
          .thenComparing(RankedResult::chunkId);

  private final QueryDecomposer decomposer;
  private final SubQuestionRetriever subQuestionRetriever;
  private final Generator generator;
  private final VerificationAggregator verificationAggregator;
  private final FinalDecisionPolicy decisionPolicy;
  private final FanOut fanOut;
  private final Executor subQuestionExecutor;
  private final PipelineProperties properties;
  private final Clock clock;

  QueryPipeline(
      QueryDecomposer decomposer,
      SubQuestionRetriever subQuestionRetriever,
      Generator generator,
      VerificationAggregator verificationAggregator,
      FinalDecisionPolicy decisionPolicy,
      FanOut fanOut,
      @Qualifier("subQuestionExecutor") Executor subQuestionExecutor,
      PipelineProperties properties,
      Clock clock) {
    this.decomposer = decomposer;
    this.subQuestionRetriever = subQuestionRetriever;
    this.generator = generator;
    this.verificationAggregator = verificationAggregator;
    this.decisionPolicy = decisionPolicy;
    this.fanOut = fanOut;
    this.subQuestionExecutor = subQuestionExecutor;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Answers a question or abstains.
   *
   * @param query the raw question
   * @param mode normal or strict; null selects normal
   * @return the response; never null
   * @throws IllegalArgumentException if the query is null or blank
   */
  public PipelineResponse runPipeline(String query, @Nullable Mode mode) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    Mode effectiveMode = mode == null ? Mode.NORMAL : mode;
    Instant started = clock.instant();
    String traceId = UUID.randomUUID().toString();

    String normalized = QueryNormalizer.normalize(query);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    List<String> subQuestions = decompose(normalized);
    List<SubQuestionResult> results = retrieveAll(subQuestions, effectiveMode);

    Set<ReasonCode> reasons = new LinkedHashSet<>();
    List<SubQuestionTrace> traces = new ArrayList<>(results.size());
    boolean fallbackTriggered = false;
    boolean allProceed = true;
    double effectiveRq = 1.0;
    for (SubQuestionResult result : results) {
      reasons.addAll(result.reasons());
      traces.add(result.trace());
      fallbackTriggered |= result.fallbackTriggered();
      allProceed &= result.proceeds();
      effectiveRq = Math.min(effectiveRq, result.effectiveReport().rq());
    }
    RunContext run =
        new RunContext(traceId, started, normalized, traces, fallbackTriggered, effectiveRq);

    if (!allProceed) {
      log.info("[{}] Abstaining before generation: {}", traceId, reasons);
      return abstain(run, reasons, List.of(), null);
    }

    List<Evidence> evidence = mergeEvidence(results);
    CallOutcome<String> generated =
        fanOut.call(
            "generation",
            () -> generator.answer(normalized, evidence, effectiveMode),
            properties.timeouts().generation(),
            "");
    String answer = generated.value();
    if (generated.defaulted() || answer.isBlank()) {
      reasons.add(ReasonCode.GENERATION_FAILED);
      log.warn("[{}] Generation produced no answer", traceId);
      return abstain(run, reasons, evidence, null);
    }

    List<Integer> cited = CitationExtractor.citedPassages(answer, evidence.size());
    VerificationSignals signals =
        verificationAggregator.verify(
            new VerificationRequest(
                normalized, answer, evidence, new HashSet<>(cited), effectiveMode));
    ConfidenceReport report = decisionPolicy.decide(effectiveRq, signals, effectiveMode);
    reasons.addAll(report.reasons());

    String text;
    List<String> citations;
    switch (report.decision()) {
      case ANSWER -> {
        text = answer;
        citations = CitationExtractor.citedChunkIds(answer, evidence);
      }
      case CLARIFY -> {
        text = answer + CLARIFY_CAVEAT;
        citations = CitationExtractor.citedChunkIds(answer, evidence);
      }
      default -> {
        text = null;
        citations = List.of();
      }
    }

    return new PipelineResponse(
        text,
        citations,
        report.confidence(),
        report.decision(),
        List.copyOf(reasons),
        run.debug(clock, evidence, signals));
  }

  private List<String> decompose(String normalized) {
    int max = properties.retrieval().maxSubQuestions();
    CallOutcome<List<String>> outcome =
        fanOut.call(
            "decomposition",
            () -> decomposer.decompose(normalized, max),
            properties.timeouts().decomposition(),
            List.of(normalized));
    Set<String> distinct = new LinkedHashSet<>();
    for (String subQuestion : outcome.value()) {
      String clean = subQuestion == null ? "" : QueryNormalizer.normalize(subQuestion);
      if (!clean.isEmpty() && distinct.size() < max) {
        distinct.add(clean);
      }
    }
    if (distinct.isEmpty()) {
      return List.of(normalized);
    }
    if (distinct.size() > 1) {
      log.debug("Decomposed '{}' into {}", normalized, distinct);
    }
    return List.copyOf(distinct);
  }

  private List<SubQuestionResult> retrieveAll(List<String> subQuestions, Mode mode) {
    if (subQuestions.size() == 1) {
      return List.of(subQuestionRetriever.retrieve(subQuestions.get(0), mode));
    }
    List<CompletableFuture<SubQuestionResult>> futures = new ArrayList<>(subQuestions.size());
    for (String subQuestion : subQuestions) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> subQuestionRetriever.retrieve(subQuestion, mode), subQuestionExecutor));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  /** Union of the sub-questions' evidence, highest score per chunk, best first. */
  private List<Evidence> mergeEvidence(List<SubQuestionResult> results) {
    Map<String, RankedResult> byChunk = new LinkedHashMap<>();
    for (SubQuestionResult result : results) {
      for (RankedResult ranked : result.retrieval().results()) {
        byChunk.merge(
            ranked.chunkId(),
            ranked,
            (a, b) -> a.normalizedScore() >= b.normalizedScore() ? a : b);
      }
    }
    List<RankedResult> merged = new ArrayList<>(byChunk.values());
    merged.sort(EVIDENCE_ORDER);

    int max = properties.verification().maxEvidence();
    List<Evidence> evidence = new ArrayList<>(Math.min(max, merged.size()));
    for (int i = 0; i < merged.size() && i < max; i++) {
      RankedResult r = merged.get(i);
      evidence.add(new Evidence(r.chunkId(), r.documentId(), r.text(), r.normalizedScore()));
    }
    return evidence;
  }

  private PipelineResponse abstain(
      RunContext run,
      Set<ReasonCode> reasons,
      List<Evidence> evidence,
      @Nullable VerificationSignals signals) {
    return new PipelineResponse(
        null,
        List.of(),
        0.0,
        Decision.ABSTAIN,
        List.copyOf(reasons),
        run.debug(clock, evidence, signals));
  }

  private record RunContext(
      String traceId,
      Instant started,
      String normalizedQuery,
      List<SubQuestionTrace> subQuestions,
      boolean fallbackTriggered,
      double effectiveRq) {

    PipelineDebug debug(
        Clock clock, List<Evidence> evidence, @Nullable VerificationSignals signals) {
      List<Double> topScores = evidence.stream().map(Evidence::score).toList();
      long latencyMs = Duration.between(started, clock.instant()).toMillis();
      return new PipelineDebug(
          traceId,
          latencyMs,
          normalizedQuery,
          subQuestions,
          fallbackTriggered,
          effectiveRq,
          topScores,
          signals);
    }
  }
}
