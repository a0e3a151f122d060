package dev.verity.generation;

import java.util.List;

/** Splits a complex question into simpler, independently answerable sub-questions. */
public interface QueryDecomposer {

  /**
   * @param query the normalized question
   * @param maxSubQuestions upper bound on the returned list's size
   * @return sub-questions; a simple question comes back as the only element
   */
  List<String> decompose(String query, int maxSubQuestions);
}
