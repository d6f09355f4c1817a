package dev.sitepack.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.sitepack.compliance.CompliancePolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorTest {

  private static final String ROOT = "https://example.com/";
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final CompliancePolicy ALLOW_ALL =
      CompliancePolicy.allowAll("https://example.com/robots.txt");

  @Mock private PageFetcher crawlProvider;
  @Mock private PageFetcher fallbackFetcher;
  @Mock private SitemapParser sitemapParser;

  private final Map<String, List<String>> siteLinks = new HashMap<>();
  private CrawlOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    lenient().when(crawlProvider.method()).thenReturn(FetchMethod.CRAWL_PROVIDER);
    lenient().when(fallbackFetcher.method()).thenReturn(FetchMethod.HTTP_FALLBACK);
    lenient()
        .when(sitemapParser.discoverFromSitemap(anyString(), any(), any(), any()))
        .thenReturn(List.of());
    orchestrator = newOrchestrator(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private CrawlOrchestrator newOrchestrator(Clock clock) {
    CrawlProperties props =
        new CrawlProperties(2.0, Duration.ofMinutes(5), 1_000_000, "SitePackBot/test", "sitepackbot", 10_000);
    return new CrawlOrchestrator(crawlProvider, fallbackFetcher, sitemapParser, props, clock);
  }

  private void serveSite(PageFetcher fetcher) {
    lenient()
        .when(fetcher.fetch(anyString()))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(0);
              return new CrawlResult(
                  url, "Title of " + url, "Text of " + url, 200,
                  siteLinks.getOrDefault(url, List.of()), true, null);
            });
  }

  @Test
  void disallowedUrlsAreNeverRequestedAndDoNotConsumeBudget() {
    siteLinks.put(
        ROOT,
        List.of(
            "https://example.com/pricing",
            "https://example.com/about",
            "https://example.com/admin/users",
            "https://example.com/admin/settings",
            "https://example.com/contact",
            "https://example.com/faq"));
    when(sitemapParser.discoverFromSitemap(eq(ROOT), any(), any(), any()))
        .thenReturn(List.of("https://example.com/blog", "https://example.com/admin/logs"));
    serveSite(crawlProvider);
    CompliancePolicy policy =
        new CompliancePolicy(Set.of("/admin/*"), true, "https://example.com/robots.txt");

    CrawlOutcome outcome = orchestrator.crawl("example.com", 10, policy);

    verify(crawlProvider, never()).fetch(startsWith("https://example.com/admin"));
    assertThat(outcome.blockedCount()).isEqualTo(3);
    assertThat(outcome.pages())
        .extracting(PageRecord::url)
        .containsExactly(
            "https://example.com/",
            "https://example.com/blog",
            "https://example.com/pricing",
            "https://example.com/about",
            "https://example.com/contact",
            "https://example.com/faq");
    assertThat(outcome.successCount()).isEqualTo(6);
    assertThat(outcome.degraded()).isFalse();
    assertThat(outcome.finalMethod()).isEqualTo(FetchMethod.CRAWL_PROVIDER);
  }

  @Test
  void sitemapDiscoveryGetsThePolicyTheSharedGateAndTheCrawlDeadline() {
    serveSite(crawlProvider);
    CompliancePolicy policy =
        new CompliancePolicy(Set.of("/private/"), true, "https://example.com/robots.txt");

    orchestrator.crawl("example.com", 5, policy);

    verify(sitemapParser)
        .discoverFromSitemap(
            eq(ROOT), same(policy), any(RateLimitGate.class), eq(NOW.plus(Duration.ofMinutes(5))));
  }

  @Test
  void recordsDiscoverySourceAndFetchTimestamp() {
    siteLinks.put(ROOT, List.of("https://example.com/pricing?utm_source=nav#top"));
    serveSite(crawlProvider);

    CrawlOutcome outcome = orchestrator.crawl("example.com", 5, ALLOW_ALL);

    assertThat(outcome.pages()).hasSize(2);
    PageRecord pricing = outcome.pages().get(1);
    assertThat(pricing.url()).isEqualTo("https://example.com/pricing");
    assertThat(pricing.discoveredFrom()).isEqualTo(ROOT);
    assertThat(pricing.fetchTimestamp()).isEqualTo(NOW);
    assertThat(outcome.pages().get(0).discoveredFrom()).isEqualTo("root");
  }

  @Test
  void stopsAtPageBudget() {
    siteLinks.put(
        ROOT,
        List.of(
            "https://example.com/a", "https://example.com/b", "https://example.com/c",
            "https://example.com/d"));
    serveSite(crawlProvider);

    CrawlOutcome outcome = orchestrator.crawl("example.com", 3, ALLOW_ALL);

    assertThat(outcome.pages()).hasSize(3);
    verify(crawlProvider, times(3)).fetch(anyString());
  }

  @Test
  void ignoresLinksToOtherSites() {
    siteLinks.put(
        ROOT, List.of("https://twitter.com/example", "https://blog.example.com/post", "mailto:x@example.com"));
    serveSite(crawlProvider);

    CrawlOutcome outcome = orchestrator.crawl("example.com", 10, ALLOW_ALL);

    assertThat(outcome.pages()).extracting(PageRecord::url).containsExactly(ROOT);
  }

  @Test
  void fourPagesIsDegradedAndFiveIsNot() {
    siteLinks.put(
        ROOT,
        List.of("https://example.com/a", "https://example.com/b", "https://example.com/c"));
    serveSite(crawlProvider);

    CrawlOutcome four = orchestrator.crawl("example.com", 10, ALLOW_ALL);

    assertThat(four.successCount()).isEqualTo(4);
    assertThat(four.degraded()).isTrue();
    assertThat(four.degradedReason()).contains("4 pages");

    siteLinks.put(
        ROOT,
        List.of(
            "https://example.com/a", "https://example.com/b", "https://example.com/c",
            "https://example.com/d"));

    CrawlOutcome five = orchestrator.crawl("example.com", 10, ALLOW_ALL);

    assertThat(five.successCount()).isEqualTo(5);
    assertThat(five.degraded()).isFalse();
    assertThat(five.degradedReason()).isNull();
  }

  @Test
  void failedPagesAreRecordedNotThrown() {
    siteLinks.put(ROOT, List.of("https://example.com/missing", "https://example.com/broken"));
    when(crawlProvider.fetch(anyString()))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(0);
              if (url.endsWith("/missing")) {
                return CrawlResult.failure(url, 404, "HTTP 404");
              }
              if (url.endsWith("/broken")) {
                throw new IllegalStateException("parser blew up");
              }
              return new CrawlResult(url, "Home", "Welcome", 200, siteLinks.get(url), true, null);
            });

    CrawlOutcome outcome = orchestrator.crawl("example.com", 10, ALLOW_ALL);

    assertThat(outcome.pages()).hasSize(3);
    assertThat(outcome.pages().get(1).success()).isFalse();
    assertThat(outcome.pages().get(1).httpStatus()).isEqualTo(404);
    assertThat(outcome.pages().get(2).success()).isFalse();
    assertThat(outcome.pages().get(2).errorMessage()).isEqualTo("parser blew up");
    assertThat(outcome.successCount()).isEqualTo(1);
    assertThat(outcome.degraded()).isTrue();
  }

  @Test
  void providerOutageSwitchesToFallbackForTheRestOfTheCrawl() {
    when(crawlProvider.fetch(anyString()))
        .thenThrow(new CrawlProviderException("Crawl provider unavailable", new RuntimeException()));
    serveSite(fallbackFetcher);

    CrawlOutcome outcome = orchestrator.crawl("example.com", 6, ALLOW_ALL);

    verify(crawlProvider, times(1)).fetch(anyString());
    assertThat(outcome.finalMethod()).isEqualTo(FetchMethod.HTTP_FALLBACK);
    assertThat(outcome.pages()).hasSize(6);
    assertThat(outcome.pages()).allMatch(p -> p.fetchMethod() == FetchMethod.HTTP_FALLBACK);
    assertThat(outcome.pages())
        .extracting(PageRecord::url)
        .containsExactly(
            "https://example.com/",
            "https://example.com/pricing",
            "https://example.com/faq",
            "https://example.com/about",
            "https://example.com/contact",
            "https://example.com/privacy");
    assertThat(outcome.pages().get(1).discoveredFrom()).isEqualTo("fallback");
  }

  @Test
  void wallClockCeilingStopsNewFetches() {
    Clock clock = mock(Clock.class);
    when(clock.instant()).thenReturn(NOW, NOW.plus(Duration.ofMinutes(10)));
    serveSite(crawlProvider);

    CrawlOutcome outcome = newOrchestrator(clock).crawl("example.com", 10, ALLOW_ALL);

    assertThat(outcome.pages()).isEmpty();
    assertThat(outcome.degraded()).isTrue();
    verify(crawlProvider, never()).fetch(anyString());
  }
}
