package dev.verity.scoring;

import dev.verity.config.PipelineProperties;
import dev.verity.retrieval.RankedResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Scores a reranked result list on four bounded sub-signals and combines them into RQ.
 *
 * <ul>
 *   <li>relevance: normalized score of rank 1
 *   <li>margin: rank-1 minus rank-2 normalized score, 0 with fewer than two results
 *   <li>coverage: distinct documents among the top K, over {@code min(K, corpus documents)}
 *   <li>consistency: {@code 1 - min(1, stddev(top-5) / scale)}
 * </ul>
 *
 * <p>Pure function of its inputs; the gate tier is assigned elsewhere.
 */
@Component
public class RetrievalQualityScorer {

  static final int CONSISTENCY_WINDOW = 5;

  private final PipelineProperties.Quality quality;

  public RetrievalQualityScorer(PipelineProperties properties) {
    this.quality = properties.quality();
  }

  /**
   * Scores the results of one retrieval attempt.
   *
   * @param results reranked results, best first
   * @param k the top-K cut the results were truncated to
   * @param totalDocuments distinct source documents in the corpus; 0 or less if unknown
   * @return the quality report, never null
   */
  public RetrievalQuality score(List<RankedResult> results, int k, int totalDocuments) {
    if (results.isEmpty()) {
      return new RetrievalQuality(0.0, 0.0, 0.0, 0.0, 0.0, List.of(ReasonCode.NO_RESULTS));
    }

    double relevance = Scores.clamp01(results.get(0).normalizedScore());
    double margin =
        results.size() < 2
            ? 0.0
            : Scores.clamp01(
                results.get(0).normalizedScore() - results.get(1).normalizedScore());
    double coverage = coverage(results, k, totalDocuments);
    double consistency = consistency(results);

    double rq =
        Scores.clamp01(
            quality.relevanceWeight() * relevance
                + quality.marginWeight() * margin
                + quality.coverageWeight() * coverage
                + quality.consistencyWeight() * consistency);

    List<ReasonCode> diagnostics = new ArrayList<>();
    if (relevance < quality.lowRelevance()) {
      diagnostics.add(ReasonCode.LOW_RELEVANCE);
    }
    if (results.size() >= 2 && margin < quality.lowMargin()) {
      diagnostics.add(ReasonCode.LOW_MARGIN);
    }
    if (coverage < quality.lowCoverage()) {
      diagnostics.add(ReasonCode.LOW_COVERAGE);
    }
    if (consistency < quality.lowConsistency()) {
      diagnostics.add(ReasonCode.LOW_CONSISTENCY);
    }
    return new RetrievalQuality(relevance, margin, coverage, consistency, rq, diagnostics);
  }

  private static double coverage(List<RankedResult> results, int k, int totalDocuments) {
    int window = Math.min(k, results.size());
    Set<String> documents = new HashSet<>();
    for (int i = 0; i < window; i++) {
      documents.add(results.get(i).documentId());
    }
    int denominator = totalDocuments > 0 ? Math.min(k, totalDocuments) : window;
    if (denominator <= 0) {
      return 0.0;
    }
    return Scores.clamp01((double) documents.size() / denominator);
  }

  private double consistency(List<RankedResult> results) {
    int window = Math.min(CONSISTENCY_WINDOW, results.size());
    double mean = 0.0;
    for (int i = 0; i < window; i++) {
      mean += results.get(i).normalizedScore();
    }
    mean /= window;
    double variance = 0.0;
    for (int i = 0; i < window; i++) {
      double delta = results.get(i).normalizedScore() - mean;
      variance += delta * delta;
    }
    double stddev = Math.sqrt(variance / window);
    return Scores.clamp01(1.0 - Math.min(1.0, stddev / quality.consistencyScale()));
  }
}
