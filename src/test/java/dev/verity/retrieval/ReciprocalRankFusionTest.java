package dev.verity.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  private static final double TOLERANCE = 1e-12;

  // --- Helper factory methods ---

  private static Candidate vector(String chunkId, int rank) {
    return new Candidate(
        chunkId, "doc-" + chunkId, "text " + chunkId, 0.9, rank, SourceMethod.VECTOR);
  }

  private static Candidate keyword(String chunkId, int rank) {
    return new Candidate(
        chunkId, "doc-" + chunkId, "text " + chunkId, 12.5, rank, SourceMethod.KEYWORD);
  }

  // --- Test cases ---

  @Test
  void empty_inputs_return_empty_result() {
    assertThat(ReciprocalRankFusion.fuse(List.of(), List.of())).isEmpty();
  }

  @Test
  void single_list_keeps_its_own_ranking() {
    var vector = List.of(vector("a", 1), vector("b", 2), vector("c", 3));

    List<FusedResult> fused = ReciprocalRankFusion.fuse(vector, List.of());

    assertThat(fused).extracting(FusedResult::chunkId).containsExactly("a", "b", "c");
    assertThat(fused).extracting(FusedResult::rank).containsExactly(1, 2, 3);
    assertThat(fused.get(0).fusedScore()).isCloseTo(1.0 / 61, within(TOLERANCE));
  }

  @Test
  void keyword_only_degrades_to_keyword_ranking() {
    var keyword = List.of(keyword("x", 1), keyword("y", 2));

    List<FusedResult> fused = ReciprocalRankFusion.fuse(List.of(), keyword);

    assertThat(fused).extracting(FusedResult::chunkId).containsExactly("x", "y");
  }

  @Test
  void chunk_in_both_lists_sums_contributions() {
    var vector = List.of(vector("a", 1), vector("shared", 2));
    var keyword = List.of(keyword("b", 1), keyword("shared", 2));

    List<FusedResult> fused = ReciprocalRankFusion.fuse(vector, keyword);

    assertThat(fused.get(0).chunkId()).isEqualTo("shared");
    assertThat(fused.get(0).fusedScore()).isCloseTo(2.0 / 62, within(TOLERANCE));
    assertThat(fused).hasSize(3);
  }

  @Test
  void equal_scores_and_rank_sums_fall_back_to_chunk_id_order() {
    var vector = List.of(vector("zeta", 1));
    var keyword = List.of(keyword("alpha", 1));

    List<FusedResult> fused = ReciprocalRankFusion.fuse(vector, keyword);

    assertThat(fused).extracting(FusedResult::chunkId).containsExactly("alpha", "zeta");
  }

  @Test
  void swapping_the_input_lists_yields_identical_ordering() {
    var first = List.of(vector("a", 1), vector("b", 2), vector("c", 3));
    var second = List.of(keyword("c", 1), keyword("d", 2), keyword("a", 3));

    List<FusedResult> forward = ReciprocalRankFusion.fuse(first, second);
    List<FusedResult> reversed = ReciprocalRankFusion.fuse(second, first);

    assertThat(reversed)
        .extracting(FusedResult::chunkId)
        .containsExactlyElementsOf(forward.stream().map(FusedResult::chunkId).toList());
  }

  @Test
  void duplicate_within_one_list_counts_only_best_rank() {
    var vector = List.of(vector("a", 1), vector("a", 5));

    List<FusedResult> fused = ReciprocalRankFusion.fuse(vector, List.of());

    assertThat(fused).hasSize(1);
    assertThat(fused.get(0).fusedScore()).isCloseTo(1.0 / 61, within(TOLERANCE));
  }

  @Test
  void custom_k_changes_contribution() {
    List<FusedResult> fused = ReciprocalRankFusion.fuse(List.of(vector("a", 1)), List.of(), 1);

    assertThat(fused.get(0).fusedScore()).isCloseTo(0.5, within(TOLERANCE));
  }

  @Test
  void non_positive_k_is_rejected() {
    assertThatThrownBy(() -> ReciprocalRankFusion.fuse(List.of(), List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("k must be >= 1");
  }

  @Test
  void fused_result_keeps_document_and_text() {
    List<FusedResult> fused = ReciprocalRankFusion.fuse(List.of(vector("a", 1)), List.of());

    assertThat(fused.get(0).documentId()).isEqualTo("doc-a");
    assertThat(fused.get(0).text()).isEqualTo("text a");
  }
}
