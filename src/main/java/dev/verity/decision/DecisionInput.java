package dev.verity.decision;

import dev.verity.config.PipelineProperties;
import dev.verity.verification.VerificationSignals;

/**
 * Everything a decision rule may look at.
 *
 * @param rq the effective retrieval quality (post-fallback when a fallback ran)
 * @param signals verification of the generated answer
 * @param confidence CONF computed from {@code rq} and {@code signals}
 * @param settings the active mode's thresholds
 */
record DecisionInput(
    double rq,
    VerificationSignals signals,
    double confidence,
    PipelineProperties.ModeSettings settings) {}
