package dev.sitepack.crawl;

/**
 * Thrown when the crawl provider keeps failing after retries. The crawl orchestrator reacts by
 * switching to the fallback fetcher for the remainder of the run.
 */
public class CrawlProviderException extends RuntimeException {

  public CrawlProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
