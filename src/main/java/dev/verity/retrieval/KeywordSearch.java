package dev.verity.retrieval;

import java.util.List;

/**
 * Lexical retrieval collaborator. Invoked with a pipeline-side timeout; implementations must be
 * safe to call concurrently and to abandon.
 */
public interface KeywordSearch {

  /**
   * Returns up to {@code k} candidates ordered by lexical relevance, ranked from 1, with {@link
   * SourceMethod#KEYWORD}.
   */
  List<Candidate> search(String queryText, int k);
}
