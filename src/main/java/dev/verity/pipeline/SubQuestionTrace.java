package dev.verity.pipeline;

import dev.verity.gate.RetrievalQualityReport;
import org.jspecify.annotations.Nullable;

/**
 * Debug view of one sub-question's retrieval. The initial report is kept for diagnostics even when
 * a fallback replaced it.
 */
public record SubQuestionTrace(
    String question,
    RetrievalQualityReport initialReport,
    @Nullable RetrievalQualityReport fallbackReport,
    @Nullable String rewrittenQuery) {}
