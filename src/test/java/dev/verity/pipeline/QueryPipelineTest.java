package dev.verity.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.verify;

import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import dev.verity.decision.Decision;
import dev.verity.decision.FinalDecisionPolicy;
import dev.verity.fixture.RankedResultBuilder;
import dev.verity.fixture.SignalsBuilder;
import dev.verity.fixture.TestExecutors;
import dev.verity.gate.GateTier;
import dev.verity.gate.RetrievalQualityReport;
import dev.verity.generation.Evidence;
import dev.verity.generation.Generator;
import dev.verity.generation.QueryDecomposer;
import dev.verity.retrieval.RankedResult;
import dev.verity.retrieval.RetrievalBreadth;
import dev.verity.retrieval.RetrievalOutcome;
import dev.verity.scoring.ReasonCode;
import dev.verity.scoring.RetrievalQuality;
import dev.verity.verification.CheckKind;
import dev.verity.verification.VerificationAggregator;
import dev.verity.verification.VerificationRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryPipelineTest {

  private static final PipelineProperties PROPERTIES = PipelineProperties.defaults();
  private static final RetrievalBreadth INITIAL = RetrievalBreadth.initial(PROPERTIES.retrieval());

  @Mock QueryDecomposer decomposer;

  @Mock SubQuestionRetriever subQuestionRetriever;

  @Mock Generator generator;

  @Mock VerificationAggregator verificationAggregator;

  @Captor ArgumentCaptor<List<Evidence>> evidenceCaptor;

  @Captor ArgumentCaptor<VerificationRequest> verificationCaptor;

  QueryPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline =
        new QueryPipeline(
            decomposer,
            subQuestionRetriever,
            generator,
            verificationAggregator,
            new FinalDecisionPolicy(PROPERTIES),
            TestExecutors.fanOut(),
            TestExecutors.daemonPool(),
            PROPERTIES,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  private static RetrievalQualityReport report(double rq, GateTier tier) {
    return new RetrievalQualityReport(
        new RetrievalQuality(rq, 0.2, 0.5, 0.8, rq, List.of()), tier);
  }

  private static SubQuestionResult proceeding(
      String question, double rq, List<RankedResult> results) {
    return new SubQuestionResult(
        question,
        report(rq, GateTier.PROCEED),
        null,
        null,
        new RetrievalOutcome(question, INITIAL, results, 5, 5, false, List.of()),
        true,
        List.of());
  }

  private void singleQuestion() {
    given(decomposer.decompose(anyString(), anyInt()))
        .willAnswer(invocation -> List.of(invocation.<String>getArgument(0)));
  }

  @Test
  void strongRetrievalAndCleanVerificationAnswers() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("What k does RRF use?", Mode.NORMAL))
        .willReturn(
            proceeding("What k does RRF use?", 0.6, RankedResultBuilder.withScores(0.9, 0.7)));
    given(generator.answer(eq("What k does RRF use?"), anyList(), eq(Mode.NORMAL)))
        .willReturn("RRF uses k = 60 [1].");
    given(verificationAggregator.verify(any()))
        .willReturn(new SignalsBuilder().groundedness(0.9).build());

    PipelineResponse response = pipeline.runPipeline("  What k   does RRF use? ", null);

    assertThat(response.decision()).isEqualTo(Decision.ANSWER);
    assertThat(response.answer()).isEqualTo("RRF uses k = 60 [1].");
    assertThat(response.citations()).containsExactly("chunk-1");
    assertThat(response.confidence()).isCloseTo(0.66, within(1e-9));
    assertThat(response.reasons()).containsExactly(ReasonCode.CONFIDENCE_HIGH);
    assertThat(response.debug().normalizedQuery()).isEqualTo("What k does RRF use?");
    assertThat(response.debug().fallbackTriggered()).isFalse();
    assertThat(response.debug().topScores()).containsExactly(0.9, 0.7);
    assertThat(response.debug().latencyMs()).isZero();

    verify(verificationAggregator).verify(verificationCaptor.capture());
    assertThat(verificationCaptor.getValue().citedPassages()).containsExactly(1);
  }

  @Test
  void abstainAfterFailedFallbackNeverGenerates() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("obscure question", Mode.NORMAL))
        .willReturn(
            new SubQuestionResult(
                "obscure question",
                report(0.4, GateTier.FALLBACK),
                report(0.3, GateTier.ABSTAIN),
                "rewritten question",
                new RetrievalOutcome(
                    "rewritten question",
                    RetrievalBreadth.widened(PROPERTIES.retrieval()),
                    RankedResultBuilder.withScores(0.3),
                    1,
                    1,
                    false,
                    List.of()),
                false,
                List.of(
                    ReasonCode.FALLBACK_USED, ReasonCode.LOW_RETRIEVAL_QUALITY_AFTER_FALLBACK)));

    PipelineResponse response = pipeline.runPipeline("obscure question", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.ABSTAIN);
    assertThat(response.answer()).isNull();
    assertThat(response.citations()).isEmpty();
    assertThat(response.confidence()).isZero();
    assertThat(response.reasons()).contains(ReasonCode.LOW_RETRIEVAL_QUALITY_AFTER_FALLBACK);
    assertThat(response.debug().fallbackTriggered()).isTrue();
    assertThat(response.debug().effectiveRq()).isEqualTo(0.3);
    assertThat(response.debug().subQuestions().get(0).initialReport().rq()).isEqualTo(0.4);
    assertThat(response.debug().verification()).isNull();
    then(generator).shouldHaveNoInteractions();
    then(verificationAggregator).shouldHaveNoInteractions();
  }

  @Test
  void weakRetrievalAbstainsWithoutFallback() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("off topic", Mode.NORMAL))
        .willReturn(
            new SubQuestionResult(
                "off topic",
                report(0.2, GateTier.ABSTAIN),
                null,
                null,
                new RetrievalOutcome(
                    "off topic",
                    INITIAL,
                    RankedResultBuilder.withScores(0.2),
                    1,
                    1,
                    false,
                    List.of()),
                false,
                List.of(ReasonCode.LOW_RETRIEVAL_QUALITY)));

    PipelineResponse response = pipeline.runPipeline("off topic", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.ABSTAIN);
    assertThat(response.reasons()).containsExactly(ReasonCode.LOW_RETRIEVAL_QUALITY);
    assertThat(response.debug().fallbackTriggered()).isFalse();
    then(generator).shouldHaveNoInteractions();
  }

  @Test
  void blankQueryIsRejected() {
    assertThatThrownBy(() -> pipeline.runPipeline("   ", Mode.NORMAL))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pipeline.runPipeline(null, Mode.NORMAL))
        .isInstanceOf(IllegalArgumentException.class);
    then(subQuestionRetriever).shouldHaveNoInteractions();
  }

  @Test
  void clarifyAppendsCaveat() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("q", Mode.NORMAL))
        .willReturn(proceeding("q", 0.8, RankedResultBuilder.withScores(0.9)));
    given(generator.answer(eq("q"), anyList(), eq(Mode.NORMAL))).willReturn("Partly [1].");
    given(verificationAggregator.verify(any()))
        .willReturn(
            new SignalsBuilder().groundedness(0.6).warn(CheckKind.GROUNDEDNESS).build());

    PipelineResponse response = pipeline.runPipeline("q", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.CLARIFY);
    assertThat(response.answer()).isEqualTo("Partly [1]." + QueryPipeline.CLARIFY_CAVEAT);
    assertThat(response.citations()).containsExactly("chunk-1");
    assertThat(response.reasons()).startsWith(ReasonCode.LOW_GROUNDEDNESS);
  }

  @Test
  void abstainAfterVerificationDropsAnswerAndCitations() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("q", Mode.NORMAL))
        .willReturn(proceeding("q", 0.8, RankedResultBuilder.withScores(0.9, 0.8)));
    given(generator.answer(eq("q"), anyList(), eq(Mode.NORMAL))).willReturn("Both [1] [2].");
    given(verificationAggregator.verify(any()))
        .willReturn(new SignalsBuilder().contradictionRate(0.9).build());

    PipelineResponse response = pipeline.runPipeline("q", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.ABSTAIN);
    assertThat(response.answer()).isNull();
    assertThat(response.citations()).isEmpty();
    assertThat(response.reasons()).contains(ReasonCode.CONTRADICTION_DETECTED);
    assertThat(response.debug().verification()).isNotNull();
  }

  @Test
  void generationFailureAbstains() {
    singleQuestion();
    given(subQuestionRetriever.retrieve("q", Mode.NORMAL))
        .willReturn(proceeding("q", 0.8, RankedResultBuilder.withScores(0.9)));
    given(generator.answer(eq("q"), anyList(), eq(Mode.NORMAL)))
        .willThrow(new IllegalStateException("model overloaded"));

    PipelineResponse response = pipeline.runPipeline("q", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.ABSTAIN);
    assertThat(response.reasons()).containsExactly(ReasonCode.GENERATION_FAILED);
    then(verificationAggregator).shouldHaveNoInteractions();
  }

  @Test
  void subQuestionEvidenceIsMergedAndWeakestRetrievalScoresConfidence() {
    given(decomposer.decompose("a and b", 5)).willReturn(List.of("a?", " b? ", "a?"));
    given(subQuestionRetriever.retrieve("a?", Mode.NORMAL))
        .willReturn(
            proceeding(
                "a?",
                0.8,
                List.of(
                    new RankedResultBuilder().chunkId("c1").normalizedScore(0.9).build(),
                    new RankedResultBuilder().chunkId("c2").normalizedScore(0.5).build())));
    given(subQuestionRetriever.retrieve("b?", Mode.NORMAL))
        .willReturn(
            proceeding(
                "b?",
                0.6,
                List.of(
                    new RankedResultBuilder().chunkId("c2").normalizedScore(0.7).build(),
                    new RankedResultBuilder().chunkId("c3").normalizedScore(0.6).build())));
    given(generator.answer(eq("a and b"), anyList(), eq(Mode.NORMAL))).willReturn("A [1], B [3].");
    given(verificationAggregator.verify(any())).willReturn(new SignalsBuilder().build());

    PipelineResponse response = pipeline.runPipeline("a and b", Mode.NORMAL);

    verify(generator).answer(eq("a and b"), evidenceCaptor.capture(), eq(Mode.NORMAL));
    assertThat(evidenceCaptor.getValue())
        .extracting(Evidence::chunkId, Evidence::score)
        .containsExactly(tuple("c1", 0.9), tuple("c2", 0.7), tuple("c3", 0.6));
    assertThat(response.debug().subQuestions())
        .extracting(SubQuestionTrace::question)
        .containsExactly("a?", "b?");
    assertThat(response.debug().effectiveRq()).isEqualTo(0.6);
    assertThat(response.citations()).containsExactly("c1", "c3");
  }

  @Test
  void anyAbstainingSubQuestionAbstainsTheQuery() {
    given(decomposer.decompose("a and b", 5)).willReturn(List.of("a?", "b?"));
    given(subQuestionRetriever.retrieve("a?", Mode.NORMAL))
        .willReturn(proceeding("a?", 0.9, RankedResultBuilder.withScores(0.9)));
    given(subQuestionRetriever.retrieve("b?", Mode.NORMAL))
        .willReturn(
            new SubQuestionResult(
                "b?",
                report(0.1, GateTier.ABSTAIN),
                null,
                null,
                new RetrievalOutcome("b?", INITIAL, List.of(), 0, 0, true, List.of()),
                false,
                List.of(ReasonCode.NO_EVIDENCE)));

    PipelineResponse response = pipeline.runPipeline("a and b", Mode.NORMAL);

    assertThat(response.decision()).isEqualTo(Decision.ABSTAIN);
    assertThat(response.reasons()).containsExactly(ReasonCode.NO_EVIDENCE);
    then(generator).shouldHaveNoInteractions();
  }

  @Test
  void failedDecompositionFallsBackToTheWholeQuestion() {
    given(decomposer.decompose("q", 5)).willThrow(new IllegalStateException("bad JSON"));
    given(subQuestionRetriever.retrieve("q", Mode.STRICT))
        .willReturn(proceeding("q", 0.9, RankedResultBuilder.withScores(0.95)));
    given(generator.answer(eq("q"), anyList(), eq(Mode.STRICT))).willReturn("Yes [1].");
    given(verificationAggregator.verify(any())).willReturn(new SignalsBuilder().build());

    PipelineResponse response = pipeline.runPipeline("q", Mode.STRICT);

    assertThat(response.decision()).isEqualTo(Decision.ANSWER);
    assertThat(response.debug().subQuestions()).hasSize(1);
  }
}
