package dev.sitepack.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for relevance ranking.
 *
 * <p>Properties are bound from {@code sitepack.ranking.*} in application.yml.
 *
 * <ul>
 *   <li>{@code semantic-enabled} - ask the extraction service for a relevance judgment per page
 *       (default true)
 *   <li>{@code semantic-weight} - multiplier applied to the [0, 1] relevance judgment (default
 *       100, bounded [0, 500])
 *   <li>{@code preview-chars} - leading characters of page content sent for the judgment
 *       (default 2000, bounded [200, 10000])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "sitepack.ranking")
public class RankingProperties {

  private boolean semanticEnabled = true;
  private double semanticWeight = 100.0;
  private int previewChars = 2000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (semanticWeight < 0.0 || semanticWeight > 500.0) {
      throw new IllegalStateException(
          "sitepack.ranking.semantic-weight must be in [0, 500], got: " + semanticWeight);
    }
    if (previewChars < 200 || previewChars > 10_000) {
      throw new IllegalStateException(
          "sitepack.ranking.preview-chars must be in [200, 10000], got: " + previewChars);
    }
  }

  public boolean isSemanticEnabled() {
    return semanticEnabled;
  }

  public void setSemanticEnabled(boolean semanticEnabled) {
    this.semanticEnabled = semanticEnabled;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public int getPreviewChars() {
    return previewChars;
  }

  public void setPreviewChars(int previewChars) {
    this.previewChars = previewChars;
  }
}
