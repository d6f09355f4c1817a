package dev.sitepack.crawl;

import dev.sitepack.compliance.CompliancePolicy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Breadth-first crawl of one domain. Seeds the frontier with the root page and the sitemap,
 * follows same-site links, and stops on budget exhaustion, frontier exhaustion, or the
 * wall-clock ceiling.
 *
 * <p>URLs disallowed by robots.txt are dropped before any request and do not consume budget.
 * When the crawl provider gives up ({@link CrawlProviderException}), the rest of the crawl runs
 * on the fallback fetcher and a handful of well-known business paths are added to the frontier.
 * Page failures are recorded as unsuccessful {@link PageRecord}s, never thrown.
 */
@Service
public class CrawlOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

  static final int MIN_PAGES = 5;

  static final List<String> FALLBACK_SEED_PATHS =
      List.of("/pricing", "/faq", "/about", "/contact", "/privacy", "/terms", "/careers", "/blog");

  private final PageFetcher crawlProvider;
  private final PageFetcher fallbackFetcher;
  private final SitemapParser sitemapParser;
  private final CrawlProperties properties;
  private final Clock clock;

  public CrawlOrchestrator(
      @Qualifier("crawl4AiClient") PageFetcher crawlProvider,
      @Qualifier("httpFallbackFetcher") PageFetcher fallbackFetcher,
      SitemapParser sitemapParser,
      CrawlProperties properties,
      Clock clock) {
    this.crawlProvider = crawlProvider;
    this.fallbackFetcher = fallbackFetcher;
    this.sitemapParser = sitemapParser;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Crawl a domain.
   *
   * @param domain bare domain name
   * @param pageBudget maximum number of fetch attempts
   * @param policy robots.txt policy for the domain
   * @return every attempted page in fetch order, with the degraded flag
   */
  public CrawlOutcome crawl(String domain, int pageBudget, CompliancePolicy policy) {
    String rootUrl = UrlNormalizer.normalize("https://" + domain + "/");
    RateLimitGate gate = RateLimitGate.create(properties.requestsPerSecond(), pageBudget);
    Instant deadline = clock.instant().plus(properties.maxDuration());

    Frontier frontier = new Frontier(rootUrl);
    frontier.offer(rootUrl, "root");
    for (String url : sitemapParser.discoverFromSitemap(rootUrl, policy, gate, deadline)) {
      frontier.offer(url, "sitemap");
    }
    log.info(
        "Starting crawl of {} (budget={}, seed URLs={}, disallowed paths={})",
        rootUrl,
        pageBudget,
        frontier.size(),
        policy.disallowPaths().size());

    PageFetcher active = crawlProvider;
    List<PageRecord> pages = new ArrayList<>();
    int blocked = 0;
    int successes = 0;

    while (!frontier.isEmpty()) {
      if (gate.remaining() <= 0) {
        log.info("Page budget of {} exhausted for {}", pageBudget, domain);
        break;
      }
      if (!clock.instant().isBefore(deadline)) {
        log.warn("Crawl of {} hit the {} wall-clock ceiling", domain, properties.maxDuration());
        break;
      }

      FrontierEntry next = frontier.poll();
      if (!policy.isAllowed(next.url())) {
        log.debug("Blocked by robots.txt: {}", next.url());
        blocked++;
        continue;
      }
      if (!gate.tryAcquire()) {
        break;
      }

      CrawlResult result;
      try {
        result = active.fetch(next.url());
      } catch (CrawlProviderException e) {
        if (active == crawlProvider) {
          log.warn("Crawl provider down, switching to fallback fetcher: {}", e.getMessage());
          active = fallbackFetcher;
          for (String path : FALLBACK_SEED_PATHS) {
            frontier.offer(UrlNormalizer.normalizeToBase(rootUrl) + path, "fallback");
          }
          result = fetchQuietly(active, next.url());
        } else {
          result = CrawlResult.failure(next.url(), 0, e.getMessage());
        }
      } catch (RuntimeException e) {
        log.warn("Error fetching {}: {}", next.url(), e.getMessage());
        result = CrawlResult.failure(next.url(), 0, e.getMessage());
      }

      pages.add(toRecord(next, result, active.method()));
      if (result.success()) {
        successes++;
        for (String link : result.internalLinks()) {
          frontier.offer(link, next.url());
        }
      } else {
        log.warn("Failed to fetch {}: {}", next.url(), result.errorMessage());
      }
    }

    boolean degraded = successes < MIN_PAGES;
    String reason =
        degraded
            ? "Only " + successes + " pages retrieved from " + domain + " (minimum " + MIN_PAGES + ")"
            : null;
    log.info(
        "Crawl of {} finished: {} attempted, {} succeeded, {} blocked, method={}",
        domain,
        pages.size(),
        successes,
        blocked,
        active.method());
    if (degraded) {
      log.warn(reason);
    }
    return new CrawlOutcome(pages, active.method(), degraded, reason, blocked, successes);
  }

  private static CrawlResult fetchQuietly(PageFetcher fetcher, String url) {
    try {
      return fetcher.fetch(url);
    } catch (RuntimeException e) {
      log.warn("Fallback fetch of {} failed: {}", url, e.getMessage());
      return CrawlResult.failure(url, 0, e.getMessage());
    }
  }

  private PageRecord toRecord(FrontierEntry entry, CrawlResult result, FetchMethod method) {
    return new PageRecord(
        entry.url(),
        result.title(),
        result.text(),
        result.statusCode(),
        entry.discoveredFrom(),
        clock.instant(),
        result.success(),
        method,
        result.errorMessage());
  }

  private record FrontierEntry(String url, String discoveredFrom) {}

  /** FIFO queue of same-site URLs, each offered at most once. */
  private static final class Frontier {

    private final String rootUrl;
    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<String> seen = new HashSet<>();

    Frontier(String rootUrl) {
      this.rootUrl = rootUrl;
    }

    void offer(String url, String discoveredFrom) {
      String normalized = UrlNormalizer.normalize(url);
      if (normalized == null || !UrlNormalizer.isSameSite(rootUrl, normalized)) {
        return;
      }
      if (seen.add(normalized)) {
        queue.add(new FrontierEntry(normalized, discoveredFrom));
      }
    }

    FrontierEntry poll() {
      return queue.poll();
    }

    boolean isEmpty() {
      return queue.isEmpty();
    }

    int size() {
      return queue.size();
    }
  }
}
