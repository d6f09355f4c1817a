package dev.sitepack.crawl;

/**
 * Contract shared by the crawl provider and its reduced-capability fallback.
 *
 * <p>Page-level problems (HTTP errors, empty bodies) are reported as a failed {@link CrawlResult}.
 * An implementation throws {@link CrawlProviderException} only when the fetcher itself is
 * unusable and the caller should stop relying on it.
 */
public interface PageFetcher {

  /**
   * Fetch a single page.
   *
   * @param url absolute URL to fetch
   * @return the page result, successful or not
   * @throws CrawlProviderException if the underlying provider is unavailable
   */
  CrawlResult fetch(String url);

  /** The method recorded on pages produced by this fetcher. */
  FetchMethod method();
}
