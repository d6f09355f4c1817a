package dev.sitepack.crawl;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * One fetch attempt made during a crawl. Lives only for the duration of the run.
 *
 * @param discoveredFrom where the URL came from: {@code root}, {@code sitemap}, {@code fallback}
 *     or the URL of the page that linked to it
 */
public record PageRecord(
    String url,
    @Nullable String title,
    @Nullable String rawContent,
    int httpStatus,
    String discoveredFrom,
    Instant fetchTimestamp,
    boolean success,
    FetchMethod fetchMethod,
    @Nullable String errorMessage) {}
