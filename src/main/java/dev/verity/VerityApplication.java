package dev.verity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Verity question-answering core. Runs without a web server; transports wire
 * {@link dev.verity.pipeline.QueryPipeline} in from outside.
 */
@SpringBootApplication
public class VerityApplication {
  public static void main(String[] args) {
    SpringApplication.run(VerityApplication.class, args);
  }
}
