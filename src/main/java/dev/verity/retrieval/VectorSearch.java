package dev.verity.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/**
 * Vector-similarity retrieval collaborator. Invoked with a pipeline-side timeout; implementations
 * must be safe to call concurrently and to abandon.
 */
public interface VectorSearch {

  /**
   * Returns up to {@code k} candidates ordered by similarity, ranked from 1, with {@link
   * SourceMethod#VECTOR}.
   */
  List<Candidate> search(Embedding queryEmbedding, int k);
}
