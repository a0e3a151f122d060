package dev.verity.retrieval;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.verity.concurrent.CallOutcome;
import dev.verity.concurrent.FanOut;
import dev.verity.config.PipelineProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one retrieval attempt: vector and keyword search in parallel, Reciprocal Rank Fusion,
 * cross-encoder reranking of the fused head, and logistic normalization of the rerank scores.
 *
 * <p>Pipeline: embed query (with the BGE retrieval prefix) and vector-search, concurrently with
 * keyword search -> join -> fuse -> rerank the top {@code rerankCandidates} concurrently -> join
 * -> sort by normalized score -> keep {@code topK}.
 *
 * <p>Every external call runs through {@link FanOut} with its own timeout. A failed search
 * contributes an empty list; a failed rerank call contributes a {@code NaN} score, which
 * normalizes to 0.0. If both searches come back empty the outcome is marked {@linkplain
 * RetrievalOutcome#unavailable() unavailable}.
 */
@Service
public class RetrievalService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to
   * queries only, never to indexed chunks.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private static final Comparator<RankedResult> RERANKED_ORDER =
      Comparator.comparingDouble(RankedResult::normalizedScore)
          .reversed()
          .thenComparingInt(RankedResult::fusedRank);

  private final EmbeddingModel embeddingModel;
  private final VectorSearch vectorSearch;
  private final KeywordSearch keywordSearch;
  private final Reranker reranker;
  private final FanOut fanOut;
  private final PipelineProperties properties;

  public RetrievalService(
      EmbeddingModel embeddingModel,
      VectorSearch vectorSearch,
      KeywordSearch keywordSearch,
      Reranker reranker,
      FanOut fanOut,
      PipelineProperties properties) {
    this.embeddingModel = embeddingModel;
    this.vectorSearch = vectorSearch;
    this.keywordSearch = keywordSearch;
    this.reranker = reranker;
    this.fanOut = fanOut;
    this.properties = properties;
  }

  /**
   * Retrieves and reranks evidence for a query.
   *
   * @param query the (normalized) query text
   * @param breadth how many candidates to fetch, rerank and keep
   * @return the reranked evidence; never throws for collaborator failures
   */
  public RetrievalOutcome retrieve(String query, RetrievalBreadth breadth) {
    PipelineProperties.Timeouts timeouts = properties.timeouts();
    Duration vectorTimeout = timeouts.embedding().plus(timeouts.search());

    CompletableFuture<CallOutcome<List<Candidate>>> vectorCall =
        fanOut.submit(
            "vector-search",
            () ->
                vectorSearch.search(
                    embeddingModel.embed(BGE_QUERY_PREFIX + query).content(),
                    breadth.candidatePool()),
            vectorTimeout,
            List.of());
    CompletableFuture<CallOutcome<List<Candidate>>> keywordCall =
        fanOut.submit(
            "keyword-search",
            () -> keywordSearch.search(query, breadth.candidatePool()),
            timeouts.search(),
            List.of());

    List<CallOutcome<List<Candidate>>> searches =
        FanOut.joinAll(List.of(vectorCall, keywordCall));
    List<Candidate> vectorHits = searches.get(0).value();
    List<Candidate> keywordHits = searches.get(1).value();

    List<String> defaultedCalls = new ArrayList<>();
    for (CallOutcome<List<Candidate>> search : searches) {
      if (search.defaulted()) {
        defaultedCalls.add(search.name());
      }
    }

    if (vectorHits.isEmpty() && keywordHits.isEmpty()) {
      log.info("Retrieval unavailable for '{}': no candidates from either search", query);
      return new RetrievalOutcome(query, breadth, List.of(), 0, 0, true, defaultedCalls);
    }

    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(vectorHits, keywordHits, properties.retrieval().rrfK());
    List<FusedResult> head = fused.subList(0, Math.min(breadth.rerankCandidates(), fused.size()));

    List<RankedResult> ranked = rerank(query, head, breadth.topK(), defaultedCalls);

    log.debug(
        "Retrieved '{}': vector={}, keyword={}, fused={}, kept={}",
        query,
        vectorHits.size(),
        keywordHits.size(),
        fused.size(),
        ranked.size());

    return new RetrievalOutcome(
        query,
        breadth,
        ranked,
        vectorHits.size(),
        keywordHits.size(),
        false,
        defaultedCalls);
  }

  private List<RankedResult> rerank(
      String query, List<FusedResult> head, int topK, List<String> defaultedCalls) {
    Duration timeout = properties.timeouts().rerank();
    List<CompletableFuture<CallOutcome<Double>>> calls = new ArrayList<>(head.size());
    for (FusedResult result : head) {
      calls.add(
          fanOut.submit(
              "rerank", () -> reranker.score(query, result.text()), timeout, Double.NaN));
    }
    List<CallOutcome<Double>> scores = FanOut.joinAll(calls);

    long failedReranks = scores.stream().filter(CallOutcome::defaulted).count();
    if (failedReranks > 0) {
      log.warn("{} of {} rerank calls defaulted for '{}'", failedReranks, head.size(), query);
      defaultedCalls.add("rerank");
    }

    List<RankedResult> unordered = new ArrayList<>(head.size());
    for (int i = 0; i < head.size(); i++) {
      FusedResult fused = head.get(i);
      double raw = scores.get(i).value();
      unordered.add(
          new RankedResult(
              fused.chunkId(),
              fused.documentId(),
              fused.text(),
              fused.fusedScore(),
              fused.rank(),
              raw,
              ScoreNormalizer.normalize(raw),
              0));
    }
    unordered.sort(RERANKED_ORDER);

    List<RankedResult> ranked = new ArrayList<>(Math.min(topK, unordered.size()));
    for (int i = 0; i < unordered.size() && i < topK; i++) {
      RankedResult r = unordered.get(i);
      ranked.add(
          new RankedResult(
              r.chunkId(),
              r.documentId(),
              r.text(),
              r.fusedScore(),
              r.fusedRank(),
              r.rerankScore(),
              r.normalizedScore(),
              i + 1));
    }
    return ranked;
  }
}
