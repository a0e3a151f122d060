package dev.verity.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure static utility merging the vector and keyword rankings with Reciprocal Rank Fusion.
 *
 * <p>Every candidate contributes {@code 1 / (k + rank)} to its chunk's score and contributions are
 * summed across both lists, so a chunk found by both methods outranks one found by a single
 * method at the same positions. Raw method scores are ignored.
 *
 * <p>Ordering is fully deterministic: fused score descending, then the lower sum of original
 * ranks, then chunk id lexical order. Swapping the two input lists yields the same ordering.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class ReciprocalRankFusion {

  /** Smoothing constant from the original RRF paper. */
  public static final int DEFAULT_K = 60;

  private static final Comparator<Accumulator> FUSED_ORDER =
      Comparator.comparingDouble(Accumulator::score)
          .reversed()
          .thenComparingInt(Accumulator::rankSum)
          .thenComparing(Accumulator::chunkId);

  private ReciprocalRankFusion() {}

  /**
   * Fuses two ranked lists. Either list may be empty; with one empty list the result follows the
   * other list's ranking.
   *
   * <p>If a list contains the same chunk more than once, only its best-ranked occurrence counts.
   *
   * @param vectorResults ranked vector-search candidates
   * @param keywordResults ranked keyword-search candidates
   * @param k the smoothing constant (must be positive)
   * @return one result per unique chunk id, ordered and ranked from 1
   */
  public static List<FusedResult> fuse(
      List<Candidate> vectorResults, List<Candidate> keywordResults, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be >= 1, got: " + k);
    }
    Map<String, Accumulator> byChunk = new LinkedHashMap<>();
    accumulate(vectorResults, k, byChunk);
    accumulate(keywordResults, k, byChunk);

    List<Accumulator> ordered = new ArrayList<>(byChunk.values());
    ordered.sort(FUSED_ORDER);

    List<FusedResult> fused = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      Accumulator acc = ordered.get(i);
      fused.add(new FusedResult(acc.chunkId, acc.documentId, acc.text, acc.score, i + 1));
    }
    return List.copyOf(fused);
  }

  /** Fuses with {@link #DEFAULT_K}. */
  public static List<FusedResult> fuse(
      List<Candidate> vectorResults, List<Candidate> keywordResults) {
    return fuse(vectorResults, keywordResults, DEFAULT_K);
  }

  private static void accumulate(
      List<Candidate> candidates, int k, Map<String, Accumulator> byChunk) {
    List<Candidate> byRank = new ArrayList<>(candidates);
    byRank.sort(Comparator.comparingInt(Candidate::rank));
    Set<String> seenInList = new HashSet<>();
    for (Candidate candidate : byRank) {
      if (!seenInList.add(candidate.chunkId())) {
        continue;
      }
      byChunk
          .computeIfAbsent(candidate.chunkId(), id -> new Accumulator(candidate))
          .add(k, candidate.rank());
    }
  }

  /** Mutable per-chunk running total, confined to a single {@code fuse} call. */
  private static final class Accumulator {
    private final String chunkId;
    private final String documentId;
    private final String text;
    private double score;
    private int rankSum;

    Accumulator(Candidate first) {
      this.chunkId = first.chunkId();
      this.documentId = first.documentId();
      this.text = first.text();
    }

    void add(int k, int rank) {
      score += 1.0 / (k + rank);
      rankSum += rank;
    }

    double score() {
      return score;
    }

    int rankSum() {
      return rankSum;
    }

    String chunkId() {
      return chunkId;
    }
  }
}
