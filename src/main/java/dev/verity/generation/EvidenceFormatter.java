package dev.verity.generation;

import java.util.List;
import java.util.StringJoiner;

/** Renders evidence as the numbered block the prompts and citation markers refer to. */
final class EvidenceFormatter {

  private EvidenceFormatter() {}

  /** {@code [1] text}, {@code [2] text}, ... separated by blank lines, at most {@code max}. */
  static String numbered(List<Evidence> evidence, int max) {
    StringJoiner block = new StringJoiner("\n\n");
    for (int i = 0; i < evidence.size() && i < max; i++) {
      block.add("[" + (i + 1) + "] " + evidence.get(i).text());
    }
    return block.toString();
  }

  /** {@code Passage 1: text}, ... for pairwise comparison, at most {@code max}. */
  static String passages(List<Evidence> evidence, int max) {
    StringJoiner block = new StringJoiner("\n\n");
    for (int i = 0; i < evidence.size() && i < max; i++) {
      block.add("Passage " + (i + 1) + ": " + evidence.get(i).text());
    }
    return block.toString();
  }
}
