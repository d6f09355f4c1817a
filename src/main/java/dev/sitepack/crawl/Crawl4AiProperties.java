package dev.sitepack.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sitepack.crawl4ai")
public record Crawl4AiProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
