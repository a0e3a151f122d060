package dev.verity.retrieval;

/** Corpus-level counts needed by retrieval quality scoring. */
public interface CorpusStats {

  /** Number of distinct source documents currently retrievable. */
  int distinctDocumentCount();
}
