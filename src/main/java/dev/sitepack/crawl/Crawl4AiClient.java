package dev.sitepack.crawl;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Crawl provider backed by the Crawl4AI sidecar (headless Chromium, JS rendering).
 */
@Service
public class Crawl4AiClient implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiClient.class);

    private final RestClient restClient;

    public Crawl4AiClient(@Qualifier("crawl4AiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Crawl a single URL via the Crawl4AI sidecar.
     * Uses PruningContentFilter for boilerplate removal and headless Chromium for JS rendering.
     * Retries on transient RestClientException with exponential backoff; once attempts are
     * exhausted the provider is considered down and {@link CrawlProviderException} is thrown.
     */
    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${sitepack.crawl4ai.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${sitepack.crawl4ai.retry.delay-ms:2000}",
                    multiplierExpression = "${sitepack.crawl4ai.retry.multiplier:2.0}"
            )
    )
    public CrawlResult fetch(String url) {
        Crawl4AiRequest request = buildRequest(url);

        Crawl4AiResponse response = restClient.post()
                .uri("/crawl")
                .body(request)
                .retrieve()
                .body(Crawl4AiResponse.class);

        if (response == null || !response.success() || response.results().isEmpty()) {
            return CrawlResult.failure(url, 0, "Crawl4AI returned no results for " + url);
        }

        Crawl4AiPageResult page = response.results().get(0);
        int status = page.status_code() != null ? page.status_code() : 0;
        if (!page.success()) {
            return CrawlResult.failure(url, status, page.error_message());
        }
        if (status != 0 && (status < 200 || status >= 300)) {
            return CrawlResult.failure(url, status, "HTTP " + status);
        }

        return new CrawlResult(url, page.title(), extractMarkdown(page.markdown()),
                status == 0 ? 200 : status, page.internalLinkHrefs(), true, null);
    }

    @Recover
    CrawlResult recoverFetch(RestClientException e, String url) {
        log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
        throw new CrawlProviderException("Crawl provider unavailable while fetching " + url, e);
    }

    @Override
    public FetchMethod method() {
        return FetchMethod.CRAWL_PROVIDER;
    }

    /**
     * Prefer fitMarkdown (boilerplate-removed) over rawMarkdown.
     */
    private String extractMarkdown(Crawl4AiMarkdown markdown) {
        if (markdown == null) {
            return null;
        }
        if (markdown.fitMarkdown() != null && !markdown.fitMarkdown().isBlank()) {
            return markdown.fitMarkdown();
        }
        return markdown.rawMarkdown();
    }

    private Crawl4AiRequest buildRequest(String url) {
        return new Crawl4AiRequest(
                List.of(url),
                Map.of("type", "BrowserConfig", "params", Map.of("headless", true)),
                Map.of("type", "CrawlerRunConfig", "params", Map.of(
                        "cache_mode", "bypass",
                        "check_robots_txt", true,
                        "excluded_tags", List.of("nav", "footer", "header"),
                        "markdown_generator", Map.of(
                                "type", "DefaultMarkdownGenerator",
                                "params", Map.of(
                                        "content_filter", Map.of(
                                                "type", "PruningContentFilter",
                                                "params", Map.of("threshold", 0.48, "min_word_threshold", 20)
                                        )
                                )
                        )
                ))
        );
    }
}
