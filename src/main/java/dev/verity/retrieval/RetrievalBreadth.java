package dev.verity.retrieval;

import dev.verity.config.PipelineProperties;

/**
 * How wide one retrieval attempt casts its net.
 *
 * @param candidatePool per-source k passed to vector and keyword search
 * @param rerankCandidates how many fused results are reranked
 * @param topK how many reranked results are kept
 */
public record RetrievalBreadth(int candidatePool, int rerankCandidates, int topK) {

  /** Breadth of the first attempt for a query or sub-question. */
  public static RetrievalBreadth initial(PipelineProperties.Retrieval retrieval) {
    return new RetrievalBreadth(
        retrieval.candidatePool(), retrieval.rerankCandidates(), retrieval.topK());
  }

  /** Breadth of the single fallback attempt. */
  public static RetrievalBreadth widened(PipelineProperties.Retrieval retrieval) {
    return new RetrievalBreadth(
        retrieval.fallbackCandidatePool(),
        retrieval.fallbackRerankCandidates(),
        retrieval.fallbackTopK());
  }
}
