package dev.verity.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps {@code [n]} markers in a generated answer back to evidence. Markers outside the evidence
 * range are ignored; grouped markers such as {@code [1, 3]} are split.
 */
public final class CitationExtractor {

  private static final Pattern MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)]");

  private CitationExtractor() {}

  /** Distinct cited evidence numbers (1-based), ascending. */
  public static List<Integer> citedPassages(String answer, int evidenceCount) {
    TreeSet<Integer> cited = new TreeSet<>();
    if (answer == null) {
      return List.of();
    }
    Matcher matcher = MARKER.matcher(answer);
    while (matcher.find()) {
      for (String number : matcher.group(1).split(",")) {
        String digits = number.strip();
        if (digits.length() > 9) {
          continue;
        }
        int n = Integer.parseInt(digits);
        if (n >= 1 && n <= evidenceCount) {
          cited.add(n);
        }
      }
    }
    return List.copyOf(cited);
  }

  /** Chunk ids of the cited evidence, in evidence order. */
  public static List<String> citedChunkIds(String answer, List<Evidence> evidence) {
    List<String> chunkIds = new ArrayList<>();
    for (int n : citedPassages(answer, evidence.size())) {
      String chunkId = evidence.get(n - 1).chunkId();
      if (!chunkIds.contains(chunkId)) {
        chunkIds.add(chunkId);
      }
    }
    return chunkIds;
  }
}
