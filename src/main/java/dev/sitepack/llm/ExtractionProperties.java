package dev.sitepack.llm;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the structured-extraction service and the deep extraction fan-out.
 *
 * @param maxContentChars hard ceiling on the content sent with any single call
 * @param taskTimeout per-page extraction timeout; a timed-out page is not retried
 * @param maxWorkers upper bound on the extraction worker pool
 */
@ConfigurationProperties(prefix = "sitepack.extraction")
public record ExtractionProperties(
    String apiKey,
    String modelName,
    int maxTokens,
    double temperature,
    Duration requestTimeout,
    int maxContentChars,
    Duration taskTimeout,
    int maxWorkers) {

  public ExtractionProperties {
    if (maxContentChars <= 0) {
      throw new IllegalStateException("sitepack.extraction.max-content-chars must be positive");
    }
    if (maxWorkers <= 0) {
      throw new IllegalStateException("sitepack.extraction.max-workers must be positive");
    }
    if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
      throw new IllegalStateException("sitepack.extraction.task-timeout must be positive");
    }
  }
}
