package dev.verity.retrieval;

import dev.langchain4j.model.scoring.ScoringModel;
import org.springframework.stereotype.Component;

/**
 * {@link Reranker} backed by a LangChain4j cross-encoder {@link ScoringModel}.
 *
 * <p>Scores are returned raw (unbounded logits); normalization happens in the pipeline. Model
 * failures propagate to the caller, which applies its own timeout and default.
 */
@Component
public class ScoringModelReranker implements Reranker {

  private final ScoringModel scoringModel;

  public ScoringModelReranker(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  @Override
  public double score(String queryText, String chunkText) {
    return scoringModel.score(chunkText, queryText).content();
  }
}
