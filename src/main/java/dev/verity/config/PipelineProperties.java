package dev.verity.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable configuration for the retrieval-to-decision pipeline, bound once from {@code
 * verity.pipeline.*} and shared by reference with every pipeline stage.
 *
 * <p>All groups carry defaults, so an empty configuration is valid. Keys left unset under {@code
 * strict} fall back to the normal-mode values; an entirely absent {@code strict} group uses {@link
 * ModeSettings#strictDefaults()}.
 *
 * <p>Every record validates itself in its compact constructor; an out-of-range value throws {@link
 * IllegalStateException} and the application fails to start.
 *
 * @param retrieval retrieval breadth and fusion settings
 * @param quality retrieval quality scorer weights and calibration
 * @param normal thresholds and weights used in {@link Mode#NORMAL}
 * @param strict thresholds and weights used in {@link Mode#STRICT}
 * @param timeouts per-collaborator call timeouts
 * @param verification verification defaults and evidence limits
 */
@ConfigurationProperties(prefix = "verity.pipeline")
public record PipelineProperties(
    @DefaultValue Retrieval retrieval,
    @DefaultValue Quality quality,
    @DefaultValue ModeSettings normal,
    ModeSettings strict,
    @DefaultValue Timeouts timeouts,
    @DefaultValue Verification verification) {

  private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

  public PipelineProperties {
    if (retrieval == null) {
      retrieval = Retrieval.defaults();
    }
    if (quality == null) {
      quality = Quality.defaults();
    }
    if (normal == null) {
      normal = ModeSettings.normalDefaults();
    }
    if (strict == null) {
      strict = ModeSettings.strictDefaults();
    }
    if (timeouts == null) {
      timeouts = Timeouts.defaults();
    }
    if (verification == null) {
      verification = Verification.defaults();
    }
  }

  /** Configuration with every default applied. */
  public static PipelineProperties defaults() {
    return new PipelineProperties(null, null, null, null, null, null);
  }

  /** Returns the thresholds and weights for the given mode. */
  public ModeSettings forMode(Mode mode) {
    return mode == Mode.STRICT ? strict : normal;
  }

  /**
   * Retrieval breadth. {@code candidatePool} is the per-source k for vector and keyword search,
   * {@code rerankCandidates} caps how many fused results are sent to the reranker, and {@code
   * topK} is how many reranked results survive. The fallback variants widen all of these for the
   * single permitted retry.
   */
  public record Retrieval(
      @DefaultValue("60") int rrfK,
      @DefaultValue("50") int candidatePool,
      @DefaultValue("30") int rerankCandidates,
      @DefaultValue("10") int topK,
      @DefaultValue("100") int fallbackCandidatePool,
      @DefaultValue("60") int fallbackRerankCandidates,
      @DefaultValue("20") int fallbackTopK,
      @DefaultValue("5") int maxSubQuestions) {

    public Retrieval {
      requirePositive("retrieval.rrf-k", rrfK);
      requirePositive("retrieval.candidate-pool", candidatePool);
      requirePositive("retrieval.rerank-candidates", rerankCandidates);
      requirePositive("retrieval.top-k", topK);
      requirePositive("retrieval.max-sub-questions", maxSubQuestions);
      if (fallbackCandidatePool < candidatePool) {
        throw new IllegalStateException(
            "verity.pipeline.retrieval.fallback-candidate-pool must be >= candidate-pool, got: "
                + fallbackCandidatePool);
      }
      if (fallbackRerankCandidates < rerankCandidates) {
        throw new IllegalStateException(
            "verity.pipeline.retrieval.fallback-rerank-candidates must be >= "
                + "rerank-candidates, got: "
                + fallbackRerankCandidates);
      }
      if (fallbackTopK < topK) {
        throw new IllegalStateException(
            "verity.pipeline.retrieval.fallback-top-k must be >= top-k, got: " + fallbackTopK);
      }
    }

    public static Retrieval defaults() {
      return new Retrieval(60, 50, 30, 10, 100, 60, 20, 5);
    }
  }

  /**
   * Retrieval quality scorer weights (must sum to 1), the consistency calibration scale, and the
   * floors under which a sub-signal is reported as a diagnostic reason.
   */
  public record Quality(
      @DefaultValue("0.4") double relevanceWeight,
      @DefaultValue("0.2") double marginWeight,
      @DefaultValue("0.2") double coverageWeight,
      @DefaultValue("0.2") double consistencyWeight,
      @DefaultValue("0.25") double consistencyScale,
      @DefaultValue("0.4") double lowRelevance,
      @DefaultValue("0.1") double lowMargin,
      @DefaultValue("0.3") double lowCoverage,
      @DefaultValue("0.3") double lowConsistency) {

    public Quality {
      requireUnit("quality.relevance-weight", relevanceWeight);
      requireUnit("quality.margin-weight", marginWeight);
      requireUnit("quality.coverage-weight", coverageWeight);
      requireUnit("quality.consistency-weight", consistencyWeight);
      double sum = relevanceWeight + marginWeight + coverageWeight + consistencyWeight;
      if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
        throw new IllegalStateException(
            "verity.pipeline.quality weights must sum to 1.0, got: " + sum);
      }
      if (consistencyScale <= 0.0) {
        throw new IllegalStateException(
            "verity.pipeline.quality.consistency-scale must be > 0, got: " + consistencyScale);
      }
      requireUnit("quality.low-relevance", lowRelevance);
      requireUnit("quality.low-margin", lowMargin);
      requireUnit("quality.low-coverage", lowCoverage);
      requireUnit("quality.low-consistency", lowConsistency);
    }

    public static Quality defaults() {
      return new Quality(0.4, 0.2, 0.2, 0.2, 0.25, 0.4, 0.1, 0.3, 0.3);
    }
  }

  /**
   * Per-mode gate thresholds, confidence weights, clarify band and verification thresholds.
   *
   * @param proceedThreshold T_high: RQ at or above proceeds straight to generation
   * @param fallbackThreshold T_low: RQ below abstains without generating
   * @param alpha confidence weight of RQ
   * @param beta confidence weight of groundedness
   * @param gamma confidence penalty weight of the contradiction rate
   * @param clarifyHigh confidence at or above answers
   * @param clarifyLow confidence below abstains
   * @param groundednessWarn groundedness below this is a warn-level check outcome
   * @param contradictionWarn contradiction rate above this is a warn-level check outcome
   * @param selfConsistencyWarn self-consistency below this is a warn-level check outcome
   * @param contradictionCeiling contradiction rate above this forces abstain
   */
  public record ModeSettings(
      @DefaultValue("0.55") double proceedThreshold,
      @DefaultValue("0.35") double fallbackThreshold,
      @DefaultValue("0.5") double alpha,
      @DefaultValue("0.4") double beta,
      @DefaultValue("0.3") double gamma,
      @DefaultValue("0.6") double clarifyHigh,
      @DefaultValue("0.35") double clarifyLow,
      @DefaultValue("0.7") double groundednessWarn,
      @DefaultValue("0.5") double contradictionWarn,
      @DefaultValue("0.4") double selfConsistencyWarn,
      @DefaultValue("0.7") double contradictionCeiling) {

    public ModeSettings {
      requireUnit("proceed-threshold", proceedThreshold);
      requireUnit("fallback-threshold", fallbackThreshold);
      if (fallbackThreshold > proceedThreshold) {
        throw new IllegalStateException(
            "verity.pipeline fallback-threshold ("
                + fallbackThreshold
                + ") must not exceed proceed-threshold ("
                + proceedThreshold
                + ")");
      }
      requireNonNegative("alpha", alpha);
      requireNonNegative("beta", beta);
      requireNonNegative("gamma", gamma);
      requireUnit("clarify-high", clarifyHigh);
      requireUnit("clarify-low", clarifyLow);
      if (clarifyLow > clarifyHigh) {
        throw new IllegalStateException(
            "verity.pipeline clarify-low ("
                + clarifyLow
                + ") must not exceed clarify-high ("
                + clarifyHigh
                + ")");
      }
      requireUnit("groundedness-warn", groundednessWarn);
      requireUnit("contradiction-warn", contradictionWarn);
      requireUnit("self-consistency-warn", selfConsistencyWarn);
      requireUnit("contradiction-ceiling", contradictionCeiling);
    }

    public static ModeSettings normalDefaults() {
      return new ModeSettings(0.55, 0.35, 0.5, 0.4, 0.3, 0.6, 0.35, 0.7, 0.5, 0.4, 0.7);
    }

    public static ModeSettings strictDefaults() {
      return new ModeSettings(0.65, 0.45, 0.5, 0.4, 0.4, 0.7, 0.45, 0.85, 0.3, 0.5, 0.5);
    }
  }

  /** Timeout applied to each external collaborator call. */
  public record Timeouts(
      @DefaultValue("2s") Duration embedding,
      @DefaultValue("3s") Duration search,
      @DefaultValue("3s") Duration rerank,
      @DefaultValue("30s") Duration generation,
      @DefaultValue("15s") Duration judgment,
      @DefaultValue("10s") Duration rewrite,
      @DefaultValue("10s") Duration decomposition) {

    public Timeouts {
      requirePositive("timeouts.embedding", embedding);
      requirePositive("timeouts.search", search);
      requirePositive("timeouts.rerank", rerank);
      requirePositive("timeouts.generation", generation);
      requirePositive("timeouts.judgment", judgment);
      requirePositive("timeouts.rewrite", rewrite);
      requirePositive("timeouts.decomposition", decomposition);
    }

    public static Timeouts defaults() {
      return new Timeouts(
          Duration.ofSeconds(2),
          Duration.ofSeconds(3),
          Duration.ofSeconds(3),
          Duration.ofSeconds(30),
          Duration.ofSeconds(15),
          Duration.ofSeconds(10),
          Duration.ofSeconds(10));
    }
  }

  /**
   * Values substituted when a verification check fails or times out, and the evidence limits
   * applied to judgment prompts.
   */
  public record Verification(
      @DefaultValue("0.0") double defaultGroundedness,
      @DefaultValue("0.5") double defaultContradictionRate,
      @DefaultValue("0.0") double defaultSelfConsistency,
      @DefaultValue("10") int maxEvidence,
      @DefaultValue("5") int maxConflictPassages) {

    public Verification {
      requireUnit("verification.default-groundedness", defaultGroundedness);
      requireUnit("verification.default-contradiction-rate", defaultContradictionRate);
      requireUnit("verification.default-self-consistency", defaultSelfConsistency);
      requirePositive("verification.max-evidence", maxEvidence);
      if (maxConflictPassages < 2) {
        throw new IllegalStateException(
            "verity.pipeline.verification.max-conflict-passages must be >= 2, got: "
                + maxConflictPassages);
      }
    }

    public static Verification defaults() {
      return new Verification(0.0, 0.5, 0.0, 10, 5);
    }
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalStateException(
          "verity.pipeline." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  private static void requireNonNegative(String name, double value) {
    if (!(value >= 0.0)) {
      throw new IllegalStateException("verity.pipeline." + name + " must be >= 0, got: " + value);
    }
  }

  private static void requirePositive(String name, int value) {
    if (value < 1) {
      throw new IllegalStateException("verity.pipeline." + name + " must be >= 1, got: " + value);
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalStateException(
          "verity.pipeline." + name + " must be a positive duration, got: " + value);
    }
  }
}
