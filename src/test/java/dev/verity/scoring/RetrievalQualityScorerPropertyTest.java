package dev.verity.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import dev.verity.config.PipelineProperties;
import dev.verity.fixture.RankedResultBuilder;
import dev.verity.retrieval.RankedResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/** RQ and every sub-signal stay within [0, 1] for any reranked list. */
class RetrievalQualityScorerPropertyTest {

  private final RetrievalQualityScorer scorer =
      new RetrievalQualityScorer(PipelineProperties.defaults());

  @Provide
  Arbitrary<List<RankedResult>> rankedResults() {
    Arbitrary<Double> score = Arbitraries.doubles().between(0.0, 1.0);
    Arbitrary<String> document = Arbitraries.of("d1", "d2", "d3", "d4", "d5", "d6");
    return score
        .list()
        .ofMaxSize(25)
        .flatMap(
            scores ->
                document
                    .list()
                    .ofSize(scores.size())
                    .map(documents -> build(scores, documents)));
  }

  private static List<RankedResult> build(List<Double> scores, List<String> documents) {
    List<Double> sorted = new ArrayList<>(scores);
    sorted.sort(Comparator.reverseOrder());
    List<RankedResult> results = new ArrayList<>();
    for (int i = 0; i < sorted.size(); i++) {
      results.add(
          new RankedResultBuilder()
              .chunkId("c" + i)
              .documentId(documents.get(i))
              .normalizedScore(sorted.get(i))
              .rank(i + 1)
              .build());
    }
    return results;
  }

  @Property
  void all_signals_are_bounded(
      @ForAll("rankedResults") List<RankedResult> results,
      @ForAll @IntRange(min = 1, max = 30) int k,
      @ForAll @IntRange(min = -1, max = 60) int totalDocuments) {
    RetrievalQuality quality = scorer.score(results, k, totalDocuments);

    assertThat(quality.relevance()).isBetween(0.0, 1.0);
    assertThat(quality.margin()).isBetween(0.0, 1.0);
    assertThat(quality.coverage()).isBetween(0.0, 1.0);
    assertThat(quality.consistency()).isBetween(0.0, 1.0);
    assertThat(quality.rq()).isBetween(0.0, 1.0);
  }

  @Property
  void scoring_is_idempotent(
      @ForAll("rankedResults") List<RankedResult> results,
      @ForAll @IntRange(min = 1, max = 30) int k) {
    assertThat(scorer.score(results, k, 10)).isEqualTo(scorer.score(results, k, 10));
  }
}
