package dev.sitepack.inventory;

import dev.sitepack.crawl.FetchMethod;
import dev.sitepack.crawl.PageRecord;
import java.time.Instant;

/** Test fixtures for crawled pages. */
final class PageRecords {

  static final Instant FETCHED_AT = Instant.parse("2026-03-01T10:00:00Z");

  private PageRecords() {}

  static PageRecord ok(String url, String text) {
    return new PageRecord(
        url, "Title " + url, text, 200, "root", FETCHED_AT, true, FetchMethod.CRAWL_PROVIDER, null);
  }

  static PageRecord failed(String url, int status, String error) {
    return new PageRecord(
        url, null, null, status, "root", FETCHED_AT, false, FetchMethod.CRAWL_PROVIDER, error);
  }
}
