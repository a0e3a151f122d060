package dev.verity.verification;

import dev.verity.concurrent.CallOutcome;
import dev.verity.concurrent.FanOut;
import dev.verity.config.PipelineProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every {@link VerificationCheck} concurrently on a generated answer and joins them into
 * {@link VerificationSignals}.
 *
 * <p>A check that fails or times out contributes its conservative default and a warn verdict; it
 * never aborts the aggregation. The lexical {@link IgnoranceDetector} runs inline and its flag is
 * merged with any flag the checks raise.
 */
@Service
public class VerificationAggregator {

  private static final Logger log = LoggerFactory.getLogger(VerificationAggregator.class);

  private final List<VerificationCheck> checks;
  private final FanOut fanOut;
  private final PipelineProperties properties;

  public VerificationAggregator(
      List<VerificationCheck> checks, FanOut fanOut, PipelineProperties properties) {
    List<VerificationCheck> ordered = new ArrayList<>(checks);
    ordered.sort(Comparator.comparing(VerificationCheck::kind));
    this.checks = List.copyOf(ordered);
    this.fanOut = fanOut;
    this.properties = properties;
  }

  public VerificationSignals verify(VerificationRequest request) {
    List<CompletableFuture<CallOutcome<CheckFinding>>> calls = new ArrayList<>(checks.size());
    for (VerificationCheck check : checks) {
      CheckFinding fallback =
          CheckFinding.of(check.conservativeDefault(properties.verification()));
      calls.add(
          fanOut.submit(
              check.kind().value(),
              () -> check.evaluate(request),
              check.timeout(properties.timeouts()),
              fallback));
    }
    List<CallOutcome<CheckFinding>> outcomes = FanOut.joinAll(calls);

    PipelineProperties.ModeSettings settings = properties.forMode(request.mode());
    Set<FlagKind> flags = EnumSet.noneOf(FlagKind.class);
    if (IgnoranceDetector.admitsIgnorance(request.answer())) {
      flags.add(FlagKind.SELF_ADMITTED_IGNORANCE);
    }

    List<CheckResult> results = new ArrayList<>(checks.size());
    double groundedness = properties.verification().defaultGroundedness();
    double contradictionRate = properties.verification().defaultContradictionRate();
    double selfConsistency = properties.verification().defaultSelfConsistency();
    for (int i = 0; i < checks.size(); i++) {
      VerificationCheck check = checks.get(i);
      CallOutcome<CheckFinding> outcome = outcomes.get(i);
      double score = outcome.value().score();
      flags.addAll(outcome.value().flags());
      boolean warn = outcome.defaulted() || check.warns(score, settings);
      results.add(
          new CheckResult(
              check.kind(),
              score,
              warn ? CheckVerdict.WARN : CheckVerdict.PASS,
              outcome.defaulted()));
      switch (check.kind()) {
        case GROUNDEDNESS -> groundedness = score;
        case CONTRADICTION -> contradictionRate = score;
        case SELF_CONSISTENCY -> selfConsistency = score;
      }
    }

    VerificationSignals signals =
        new VerificationSignals(groundedness, contradictionRate, selfConsistency, flags, results);
    log.info(
        "Verification: groundedness={}, contradiction={}, selfConsistency={}, flags={}",
        String.format("%.3f", groundedness),
        String.format("%.3f", contradictionRate),
        String.format("%.3f", selfConsistency),
        flags);
    return signals;
  }
}
