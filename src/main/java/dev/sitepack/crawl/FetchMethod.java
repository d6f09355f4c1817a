package dev.sitepack.crawl;

/** How a page was retrieved. */
public enum FetchMethod {
  /** External crawl provider with JS rendering (Crawl4AI sidecar). */
  CRAWL_PROVIDER,
  /** Direct HTTP fetch with static HTML parsing, no script execution. */
  HTTP_FALLBACK
}
