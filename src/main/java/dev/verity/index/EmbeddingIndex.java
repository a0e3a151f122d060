package dev.verity.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.verity.retrieval.Candidate;
import dev.verity.retrieval.CorpusStats;
import dev.verity.retrieval.SourceMethod;
import dev.verity.retrieval.VectorSearch;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The shared vector index: a LangChain4j {@link EmbeddingStore} guarded for read-many /
 * write-exclusive access.
 *
 * <p>Searches hold the read lock, so any number of queries run concurrently. {@link #rebuild}
 * embeds every chunk before taking the write lock, then clears and repopulates the store while
 * holding it; queries issued during that window block briefly and never observe a half-written
 * index.
 */
@Component
public class EmbeddingIndex implements VectorSearch, CorpusStats {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingIndex.class);

  private static final int EMBED_BATCH_SIZE = 256;

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private int distinctDocuments;

  public EmbeddingIndex(EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public List<Candidate> search(Embedding queryEmbedding, int k) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(k).build();

    List<EmbeddingMatch<TextSegment>> matches;
    lock.readLock().lock();
    try {
      matches = embeddingStore.search(request).matches();
    } finally {
      lock.readLock().unlock();
    }

    List<Candidate> candidates = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      TextSegment segment = match.embedded();
      if (segment == null) {
        continue;
      }
      String chunkId =
          Objects.requireNonNullElse(
              segment.metadata().getString(IndexedChunk.CHUNK_ID), match.embeddingId());
      String documentId =
          Objects.requireNonNullElse(segment.metadata().getString(IndexedChunk.DOCUMENT_ID), "");
      candidates.add(
          new Candidate(
              chunkId,
              documentId,
              segment.text(),
              match.score(),
              candidates.size() + 1,
              SourceMethod.VECTOR));
    }
    return candidates;
  }

  @Override
  public int distinctDocumentCount() {
    lock.readLock().lock();
    try {
      return distinctDocuments;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Replaces the index contents with the given chunks.
   *
   * <p>Embedding runs outside the lock; only the store swap is exclusive. If embedding fails, the
   * previous contents stay untouched.
   *
   * @param chunks the complete new corpus, already chunked
   * @return number of chunks indexed
   */
  public int rebuild(List<IndexedChunk> chunks) {
    List<TextSegment> segments = chunks.stream().map(IndexedChunk::toTextSegment).toList();
    List<Embedding> embeddings = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
      List<TextSegment> batch =
          segments.subList(i, Math.min(i + EMBED_BATCH_SIZE, segments.size()));
      embeddings.addAll(embeddingModel.embedAll(batch).content());
    }
    Set<String> documents = new HashSet<>();
    chunks.forEach(chunk -> documents.add(chunk.documentId()));

    lock.writeLock().lock();
    try {
      embeddingStore.removeAll();
      if (!segments.isEmpty()) {
        embeddingStore.addAll(embeddings, segments);
      }
      distinctDocuments = documents.size();
    } finally {
      lock.writeLock().unlock();
    }

    log.info("Rebuilt index: {} chunks across {} documents", segments.size(), documents.size());
    return segments.size();
  }
}
