package dev.verity.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the LangChain4j model and store beans that back the pipeline's external collaborators.
 *
 * <p>Embedding (bge-small-en-v1.5 quantized, 384 dimensions) and cross-encoder reranking
 * (ms-marco-MiniLM-L-6-v2) run in-process on ONNX. Generation, rewriting and judgment go to an
 * OpenAI-compatible chat endpoint. Every bean is {@link ConditionalOnMissingBean}, so a deployment
 * can swap in a persistent {@link EmbeddingStore} or another chat provider without touching the
 * pipeline.
 */
@Configuration
public class ModelConfig {

  /**
   * In-process query/document embedding model.
   *
   * @return an embedding model requiring no external API
   */
  @Bean
  @ConditionalOnMissingBean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * In-process cross-encoder used as the pipeline's reranker.
   *
   * @param modelPath path to the ONNX model file
   * @param tokenizerPath path to the tokenizer JSON file
   * @return a scoring model producing unbounded query-passage relevance scores
   */
  @Bean
  @ConditionalOnMissingBean
  public ScoringModel scoringModel(
      @Value("${verity.reranker.model-path}") String modelPath,
      @Value("${verity.reranker.tokenizer-path}") String tokenizerPath) {
    return new OnnxScoringModel(modelPath, tokenizerPath);
  }

  /**
   * Vector index backing the {@code EmbeddingIndex}. In-memory by default; the index guard
   * serializes rebuilds against searches.
   *
   * @return an empty embedding store
   */
  @Bean
  @ConditionalOnMissingBean
  public EmbeddingStore<TextSegment> embeddingStore() {
    return new InMemoryEmbeddingStore<>();
  }

  /**
   * Chat model used for answering, query rewriting, decomposition and verification judgments.
   *
   * @param baseUrl OpenAI-compatible endpoint
   * @param apiKey API key for the endpoint
   * @param modelName chat model name
   * @param temperature sampling temperature for first-pass answers
   * @param timeoutMs HTTP timeout in milliseconds; the pipeline applies its own tighter per-call
   *     timeouts on top
   * @return a configured chat model
   */
  @Bean
  @ConditionalOnMissingBean
  public ChatModel chatModel(
      @Value("${verity.llm.base-url}") String baseUrl,
      @Value("${verity.llm.api-key}") String apiKey,
      @Value("${verity.llm.model-name}") String modelName,
      @Value("${verity.llm.temperature:0.1}") double temperature,
      @Value("${verity.llm.timeout-ms:60000}") long timeoutMs) {
    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(apiKey)
        .modelName(modelName)
        .temperature(temperature)
        .timeout(Duration.ofMillis(timeoutMs))
        .build();
  }
}
