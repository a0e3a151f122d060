package dev.verity.pipeline;

import java.text.Normalizer;
import java.util.regex.Pattern;

/** NFKC normalization and whitespace collapse, applied before decomposition and retrieval. */
public final class QueryNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QueryNormalizer() {}

  public static String normalize(String raw) {
    String nfkc = Normalizer.normalize(raw, Normalizer.Form.NFKC);
    return WHITESPACE.matcher(nfkc).replaceAll(" ").strip();
  }
}
