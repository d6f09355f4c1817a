package dev.sitepack.synthesis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.sitepack.crawl.FetchMethod;
import java.time.Instant;
import java.util.List;

/**
 * Run-level facts recorded at the top of the intelligence pack.
 *
 * @param robotsFetched whether a robots.txt was retrieved; false means the crawl ran fail-open
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SiteMetadata(
    String domain,
    String targetUrl,
    Instant generatedAt,
    boolean robotsFetched,
    List<String> disallowPaths,
    int pagesCrawled,
    int pagesExtracted,
    FetchMethod crawlMethod,
    DegradedSignal degraded) {
  public SiteMetadata {
    disallowPaths = List.copyOf(disallowPaths);
  }
}
