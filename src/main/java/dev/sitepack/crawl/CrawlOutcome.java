package dev.sitepack.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything the crawl produced, including failed attempts, plus the degraded flag.
 *
 * @param finalMethod the fetcher in use when the crawl stopped
 * @param blockedCount URLs skipped because robots.txt disallows them
 */
public record CrawlOutcome(
    List<PageRecord> pages,
    FetchMethod finalMethod,
    boolean degraded,
    @Nullable String degradedReason,
    int blockedCount,
    int successCount) {
  public CrawlOutcome {
    pages = List.copyOf(pages);
  }
}
