package dev.verity.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.verity.config.PipelineProperties;
import dev.verity.fixture.RankedResultBuilder;
import dev.verity.retrieval.RankedResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetrievalQualityScorerTest {

  private static final double TOLERANCE = 1e-9;

  private final RetrievalQualityScorer scorer =
      new RetrievalQualityScorer(PipelineProperties.defaults());

  @Test
  void empty_results_score_zero_with_no_results_reason() {
    RetrievalQuality quality = scorer.score(List.of(), 10, 100);

    assertThat(quality.rq()).isZero();
    assertThat(quality.relevance()).isZero();
    assertThat(quality.margin()).isZero();
    assertThat(quality.coverage()).isZero();
    assertThat(quality.consistency()).isZero();
    assertThat(quality.diagnostics()).containsExactly(ReasonCode.NO_RESULTS);
  }

  @Test
  void single_result_has_no_margin_and_full_consistency() {
    RetrievalQuality quality = scorer.score(RankedResultBuilder.withScores(0.8), 10, 1);

    assertThat(quality.relevance()).isEqualTo(0.8);
    assertThat(quality.margin()).isZero();
    assertThat(quality.coverage()).isEqualTo(1.0);
    assertThat(quality.consistency()).isEqualTo(1.0);
    assertThat(quality.rq()).isCloseTo(0.4 * 0.8 + 0.2 + 0.2, within(TOLERANCE));
    assertThat(quality.diagnostics()).isEmpty();
  }

  @Test
  void combines_weighted_sub_signals() {
    RetrievalQuality quality = scorer.score(RankedResultBuilder.withScores(0.9, 0.6, 0.5), 10, 100);

    assertThat(quality.relevance()).isEqualTo(0.9);
    assertThat(quality.margin()).isCloseTo(0.3, within(TOLERANCE));
    // 3 distinct documents over min(K=10, 100)
    assertThat(quality.coverage()).isCloseTo(0.3, within(TOLERANCE));
    assertThat(quality.consistency()).isCloseTo(0.320130731, within(1e-6));
    assertThat(quality.rq()).isCloseTo(0.544026146, within(1e-6));
  }

  @Test
  void coverage_denominator_is_capped_by_corpus_size() {
    RetrievalQuality quality = scorer.score(RankedResultBuilder.withScores(0.7, 0.7), 10, 2);

    assertThat(quality.coverage()).isEqualTo(1.0);
  }

  @Test
  void unknown_corpus_size_uses_result_count() {
    RetrievalQuality quality =
        scorer.score(RankedResultBuilder.withScores(0.7, 0.7, 0.7, 0.7), 10, 0);

    assertThat(quality.coverage()).isEqualTo(1.0);
  }

  @Test
  void results_from_one_document_have_low_coverage() {
    List<RankedResult> sameDocument =
        List.of(
            new RankedResultBuilder().chunkId("a").documentId("d").normalizedScore(0.9).build(),
            new RankedResultBuilder().chunkId("b").documentId("d").normalizedScore(0.8).build(),
            new RankedResultBuilder().chunkId("c").documentId("d").normalizedScore(0.8).build(),
            new RankedResultBuilder().chunkId("d").documentId("d").normalizedScore(0.8).build());

    RetrievalQuality quality = scorer.score(sameDocument, 10, 50);

    assertThat(quality.coverage()).isCloseTo(0.1, within(TOLERANCE));
    assertThat(quality.diagnostics()).contains(ReasonCode.LOW_COVERAGE);
  }

  @Test
  void tight_top_scores_report_low_margin() {
    RetrievalQuality quality =
        scorer.score(RankedResultBuilder.withScores(0.71, 0.70, 0.69), 10, 3);

    assertThat(quality.diagnostics()).contains(ReasonCode.LOW_MARGIN);
    assertThat(quality.consistency()).isGreaterThan(0.9);
  }

  @Test
  void weak_and_scattered_results_report_low_relevance_and_consistency() {
    RetrievalQuality quality =
        scorer.score(RankedResultBuilder.withScores(0.35, 0.05, 0.02, 0.01, 0.0), 10, 5);

    assertThat(quality.diagnostics())
        .contains(ReasonCode.LOW_RELEVANCE)
        .doesNotContain(ReasonCode.LOW_MARGIN);
  }

  @Test
  void consistency_only_considers_top_five() {
    List<RankedResult> results = RankedResultBuilder.withScores(0.8, 0.8, 0.8, 0.8, 0.8, 0.0);

    RetrievalQuality quality = scorer.score(results, 10, 10);

    assertThat(quality.consistency()).isEqualTo(1.0);
  }

  @Test
  void identical_inputs_give_identical_reports() {
    List<RankedResult> results = RankedResultBuilder.withScores(0.9, 0.4, 0.3);

    assertThat(scorer.score(results, 10, 20)).isEqualTo(scorer.score(results, 10, 20));
  }
}
