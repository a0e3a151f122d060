package dev.verity.verification;

import java.util.List;
import java.util.Locale;

/**
 * Lexical detector for answers that decline to answer, e.g. "The evidence does not contain
 * information about...". Matches explicit refusal phrases only, so legitimate negations such as
 * "not contained in the model weights" do not trigger it.
 */
public final class IgnoranceDetector {

  static final List<String> REFUSAL_PHRASES =
      List.of(
          "do not contain information",
          "does not contain information",
          "do not contain the answer",
          "does not contain the answer",
          "do not contain the necessary",
          "don't contain information",
          "doesn't contain information",
          "not contain any information",
          "cannot answer the question",
          "cannot answer this question",
          "unable to answer",
          "i cannot provide an answer",
          "i am unable to",
          "no relevant information",
          "outside the scope of",
          "is not discussed in",
          "are not discussed in",
          "do not address",
          "does not address",
          "not provided in the evidence");

  private IgnoranceDetector() {}

  public static boolean admitsIgnorance(String answer) {
    if (answer == null || answer.isBlank()) {
      return false;
    }
    String lower = answer.toLowerCase(Locale.ROOT).replace('’', '\'');
    for (String phrase : REFUSAL_PHRASES) {
      if (lower.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
