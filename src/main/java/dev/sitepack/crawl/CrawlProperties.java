package dev.sitepack.crawl;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawl limits and identity for the target site.
 *
 * @param requestsPerSecond domain-wide request ceiling, at most 2
 * @param maxDuration wall-clock ceiling for the whole crawl
 * @param maxSitemapSizeBytes sitemap files above this size are skipped
 * @param userAgent header sent on every direct request to the site
 * @param robotName token matched against robots.txt user-agent groups
 * @param fallbackMaxContentChars text ceiling for pages read by the fallback fetcher
 */
@ConfigurationProperties(prefix = "sitepack.crawl")
public record CrawlProperties(
    double requestsPerSecond,
    Duration maxDuration,
    long maxSitemapSizeBytes,
    String userAgent,
    String robotName,
    int fallbackMaxContentChars) {

  public CrawlProperties {
    if (requestsPerSecond <= 0 || requestsPerSecond > 2.0) {
      throw new IllegalStateException(
          "sitepack.crawl.requests-per-second must be in (0, 2], got " + requestsPerSecond);
    }
    if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
      throw new IllegalStateException("sitepack.crawl.max-duration must be positive");
    }
    if (fallbackMaxContentChars <= 0) {
      throw new IllegalStateException("sitepack.crawl.fallback-max-content-chars must be positive");
    }
  }
}
