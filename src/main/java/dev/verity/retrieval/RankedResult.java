package dev.verity.retrieval;

/**
 * A fused result after reranking, carrying the reranker's raw score and its logistic
 * normalization. This is the unit of evidence handed to scoring, generation and verification.
 *
 * @param chunkId unique chunk identifier
 * @param documentId identifier of the source document
 * @param text chunk text
 * @param fusedScore the Reciprocal Rank Fusion score
 * @param fusedRank 1-based rank before reranking
 * @param rerankScore the reranker's raw, unbounded score ({@code NaN} if the rerank call failed)
 * @param normalizedScore {@code rerankScore} mapped to [0, 1]
 * @param rank 1-based rank after reranking
 */
public record RankedResult(
    String chunkId,
    String documentId,
    String text,
    double fusedScore,
    int fusedRank,
    double rerankScore,
    double normalizedScore,
    int rank) {}
