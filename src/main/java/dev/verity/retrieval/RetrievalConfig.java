package dev.verity.retrieval;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retrieval collaborator defaults.
 *
 * <p>Keyword indexing lives outside this application. Without a {@link KeywordSearch} bean the
 * pipeline registers one that returns nothing, and fusion degrades to the vector ranking.
 */
@Configuration
public class RetrievalConfig {

  private static final Logger log = LoggerFactory.getLogger(RetrievalConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public KeywordSearch keywordSearch() {
    log.warn("No KeywordSearch bean configured; retrieval will use vector search only");
    return (queryText, k) -> List.of();
  }
}
