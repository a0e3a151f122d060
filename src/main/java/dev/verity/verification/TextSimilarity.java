package dev.verity.verification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Token-level similarity of two answers: {@code 2 * LCS / (|a| + |b|)} over lowercase word
 * tokens, with citation markers removed first so that citing {@code [1]} versus {@code [2]} for
 * the same sentence does not count as disagreement.
 */
public final class TextSimilarity {

  private static final Pattern CITATION = Pattern.compile("\\[\\d+]");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private TextSimilarity() {}

  /** Returns a ratio in [0, 1]; 0 if either text has no tokens. */
  public static double ratio(String a, String b) {
    List<String> left = tokens(a);
    List<String> right = tokens(b);
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    int lcs = longestCommonSubsequence(left, right);
    return (2.0 * lcs) / (left.size() + right.size());
  }

  static List<String> tokens(String text) {
    if (text == null) {
      return List.of();
    }
    String stripped = CITATION.matcher(text).replaceAll(" ").toLowerCase(Locale.ROOT);
    List<String> tokens = new ArrayList<>();
    for (String token : NON_WORD.split(stripped)) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static int longestCommonSubsequence(List<String> a, List<String> b) {
    int[] previous = new int[b.size() + 1];
    int[] current = new int[b.size() + 1];
    for (int i = 1; i <= a.size(); i++) {
      for (int j = 1; j <= b.size(); j++) {
        if (a.get(i - 1).equals(b.get(j - 1))) {
          current[j] = previous[j - 1] + 1;
        } else {
          current[j] = Math.max(previous[j], current[j - 1]);
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.size()];
  }
}
