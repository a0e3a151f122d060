package dev.verity.generation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class CitationExtractorTest {

  private static final List<Evidence> EVIDENCE =
      List.of(
          new Evidence("c-a", "d1", "first", 0.9),
          new Evidence("c-b", "d1", "second", 0.8),
          new Evidence("c-c", "d2", "third", 0.7));

  @Test
  void extractsDistinctMarkersInAscendingOrder() {
    assertThat(CitationExtractor.citedPassages("B holds [3]. A holds [1]. Again [3].", 3))
        .containsExactly(1, 3);
  }

  @Test
  void splitsGroupedMarkers() {
    assertThat(CitationExtractor.citedPassages("Both agree [1, 2].", 3)).containsExactly(1, 2);
  }

  @Test
  void ignoresMarkersOutsideTheEvidenceRange() {
    assertThat(CitationExtractor.citedPassages("See [0], [4] and [2].", 3)).containsExactly(2);
  }

  @Test
  void ignoresNonNumericBrackets() {
    assertThat(CitationExtractor.citedPassages("Use [k] or [citation needed].", 3)).isEmpty();
  }

  @Test
  void hugeMarkerDoesNotOverflow() {
    assertThat(CitationExtractor.citedPassages("[99999999999] [1]", 3)).containsExactly(1);
  }

  @Test
  void nullAnswerCitesNothing() {
    assertThat(CitationExtractor.citedPassages(null, 3)).isEmpty();
  }

  @Test
  void mapsMarkersToChunkIds() {
    assertThat(CitationExtractor.citedChunkIds("Third [3], then first [1].", EVIDENCE))
        .containsExactly("c-a", "c-c");
  }
}
