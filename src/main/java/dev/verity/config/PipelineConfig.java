package dev.verity.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Registers the immutable {@link PipelineProperties}, the clock used for latency reporting, and
 * the executor on which external collaborator calls run.
 *
 * <p>The pipeline is I/O-bound: a single query keeps several embedding, search, rerank and LLM
 * calls in flight at once, so the pool is sized for waiting threads, not CPU cores. When the queue
 * is full the pool rejects the task and {@code FanOut} defaults the call.
 *
 * <p>Sub-questions get their own pool: each sub-question task blocks while its retrieval calls
 * run on {@code pipelineExecutor}, and sharing one pool could park every worker on a join. A
 * sub-question makes no external call itself, so running it on the caller when its pool is full
 * leaves every collaborator call under its timeout.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean("pipelineExecutor")
  public Executor pipelineExecutor(
      @Value("${verity.executor.core-pool-size:16}") int corePoolSize,
      @Value("${verity.executor.max-pool-size:64}") int maxPoolSize,
      @Value("${verity.executor.queue-capacity:500}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("verity-io-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.initialize();
    return executor;
  }

  @Bean("subQuestionExecutor")
  public Executor subQuestionExecutor(
      @Value("${verity.executor.sub-question-pool-size:8}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setThreadNamePrefix("verity-subq-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
