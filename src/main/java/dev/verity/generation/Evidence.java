package dev.verity.generation;

/**
 * One evidence passage handed to the generator and the judges. Passages are numbered by their
 * position in the evidence list, starting at 1, and answers cite them as {@code [n]}.
 *
 * @param chunkId identifier of the retrieved chunk
 * @param documentId identifier of the chunk's source document
 * @param text passage text
 * @param score normalized relevance score in [0, 1]
 */
public record Evidence(String chunkId, String documentId, String text, double score) {

  public Evidence {
    if (chunkId == null || chunkId.isBlank()) {
      throw new IllegalArgumentException("chunkId must not be blank");
    }
    documentId = documentId == null ? "" : documentId;
    text = text == null ? "" : text;
  }
}
