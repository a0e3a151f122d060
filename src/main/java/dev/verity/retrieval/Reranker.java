package dev.verity.retrieval;

/** Pairwise relevance collaborator. Scores are unbounded reals; higher means more relevant. */
public interface Reranker {

  double score(String queryText, String chunkText);
}
