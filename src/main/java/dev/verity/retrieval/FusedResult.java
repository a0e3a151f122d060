package dev.verity.retrieval;

/**
 * One unique chunk after Reciprocal Rank Fusion.
 *
 * @param chunkId unique chunk identifier
 * @param documentId identifier of the source document
 * @param text chunk text
 * @param fusedScore summed {@code 1 / (k + rank)} contributions across input lists
 * @param rank 1-based fused rank
 */
public record FusedResult(
    String chunkId, String documentId, String text, double fusedScore, int rank) {}
