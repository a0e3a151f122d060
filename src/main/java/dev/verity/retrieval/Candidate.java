package dev.verity.retrieval;

/**
 * A single hit from one retrieval method, as returned by a {@link VectorSearch} or {@link
 * KeywordSearch} collaborator. Immutable once created.
 *
 * @param chunkId unique chunk identifier, the key used to merge lists during fusion
 * @param documentId identifier of the source document the chunk belongs to
 * @param text chunk text, passed to the reranker and used as evidence
 * @param rawScore the method's own score (cosine similarity, BM25, ...); not comparable across
 *     methods
 * @param rank 1-based position in the method's result list
 * @param sourceMethod which method produced the hit
 */
public record Candidate(
    String chunkId,
    String documentId,
    String text,
    double rawScore,
    int rank,
    SourceMethod sourceMethod) {

  /** Compact constructor validating input. */
  public Candidate {
    if (chunkId == null || chunkId.isBlank()) {
      throw new IllegalArgumentException("chunkId must not be blank");
    }
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
    }
    if (sourceMethod == null) {
      throw new IllegalArgumentException("sourceMethod must not be null");
    }
    documentId = documentId == null ? "" : documentId;
    text = text == null ? "" : text;
  }
}
