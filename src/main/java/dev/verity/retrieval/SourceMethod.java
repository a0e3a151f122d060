package dev.verity.retrieval;

/** The retrieval method that produced a {@link Candidate}. */
public enum SourceMethod {
  VECTOR,
  KEYWORD
}
