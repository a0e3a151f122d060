package dev.verity.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Initializes the ONNX Runtime environment before the embedding and reranking model beans exist.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, so threading options are applied from a {@link BeanFactoryPostProcessor}. The
 * reranker is called once per fused candidate and many of those calls are in flight at once, so
 * inter-op parallelism is kept low and intra-op threads do the work.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private static final int INTRA_OP_THREADS = 4;
  private static final int INTER_OP_THREADS = 2;

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(INTRA_OP_THREADS);
      threadingOptions.setGlobalInterOpNumThreads(INTER_OP_THREADS);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "verity", threadingOptions);

      log.info(
          "ONNX Runtime initialized for embedding and reranking: intra-op={}, inter-op={}",
          INTRA_OP_THREADS,
          INTER_OP_THREADS);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
