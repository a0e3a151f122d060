package dev.verity.retrieval;

import java.util.List;

/**
 * Reranked evidence from one retrieval attempt.
 *
 * @param query the query text the attempt retrieved for
 * @param breadth the breadth the attempt used
 * @param results reranked results, best first, at most {@code breadth.topK()}
 * @param vectorHits number of vector-search candidates received
 * @param keywordHits number of keyword-search candidates received
 * @param unavailable true when both search collaborators failed or returned nothing
 * @param defaultedCalls names of external calls that failed or timed out and were defaulted
 */
public record RetrievalOutcome(
    String query,
    RetrievalBreadth breadth,
    List<RankedResult> results,
    int vectorHits,
    int keywordHits,
    boolean unavailable,
    List<String> defaultedCalls) {

  public RetrievalOutcome {
    results = List.copyOf(results);
    defaultedCalls = List.copyOf(defaultedCalls);
  }
}
