package dev.verity.index;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;

/**
 * A pre-chunked passage handed to {@link EmbeddingIndex#rebuild}. Parsing and chunking happen
 * upstream.
 *
 * @param chunkId unique chunk identifier
 * @param documentId identifier of the source document
 * @param text chunk text
 */
public record IndexedChunk(String chunkId, String documentId, String text) {

  static final String CHUNK_ID = "chunk_id";
  static final String DOCUMENT_ID = "document_id";

  public IndexedChunk {
    if (chunkId == null || chunkId.isBlank()) {
      throw new IllegalArgumentException("chunkId must not be blank");
    }
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
  }

  /** Converts to a LangChain4j {@link TextSegment} carrying the ids as metadata. */
  TextSegment toTextSegment() {
    return TextSegment.from(text, Metadata.from(CHUNK_ID, chunkId).put(DOCUMENT_ID, documentId));
  }
}
