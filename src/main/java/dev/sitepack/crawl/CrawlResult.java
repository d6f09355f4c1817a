package dev.sitepack.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of fetching a single URL through a {@link PageFetcher}: title, extracted text, HTTP
 * status, discovered links, and success status.
 */
public record CrawlResult(
    String url,
    @Nullable String title,
    @Nullable String text,
    int statusCode,
    List<String> internalLinks,
    boolean success,
    @Nullable String errorMessage) {
  public CrawlResult {
    internalLinks = internalLinks == null ? List.of() : List.copyOf(internalLinks);
  }

  /** Build a failed result for a URL that could not be retrieved. */
  public static CrawlResult failure(String url, int statusCode, @Nullable String errorMessage) {
    return new CrawlResult(url, null, null, statusCode, List.of(), false, errorMessage);
  }
}
