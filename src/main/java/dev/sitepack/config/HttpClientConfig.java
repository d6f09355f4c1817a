package dev.sitepack.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Builds the {@link RestClient} instances used to talk directly to the target site.
 *
 * <p>The compliance client uses one short timeout for connect and read; a slow robots.txt counts
 * as a missing one. The fallback and sitemap clients get the regular page timeouts. All
 * three send the configured crawler user agent.
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public RestClient complianceRestClient(
      RestClient.Builder builder,
      @Value("${sitepack.crawl.user-agent}") String userAgent,
      @Value("${sitepack.crawl.compliance-timeout-ms:5000}") int timeoutMs) {
    return builder
        .clone()
        .requestFactory(requestFactory(timeoutMs, timeoutMs))
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
        .build();
  }

  @Bean
  public RestClient fallbackRestClient(
      RestClient.Builder builder,
      @Value("${sitepack.crawl.user-agent}") String userAgent,
      @Value("${sitepack.crawl.fetch-connect-timeout-ms:5000}") int connectTimeoutMs,
      @Value("${sitepack.crawl.fetch-read-timeout-ms:15000}") int readTimeoutMs) {
    return builder
        .clone()
        .requestFactory(requestFactory(connectTimeoutMs, readTimeoutMs))
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
        .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
        .build();
  }

  @Bean
  public RestClient sitemapRestClient(
      RestClient.Builder builder,
      @Value("${sitepack.crawl.user-agent}") String userAgent,
      @Value("${sitepack.crawl.fetch-connect-timeout-ms:5000}") int connectTimeoutMs,
      @Value("${sitepack.crawl.fetch-read-timeout-ms:15000}") int readTimeoutMs) {
    return builder
        .clone()
        .requestFactory(requestFactory(connectTimeoutMs, readTimeoutMs))
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
        .defaultHeader(HttpHeaders.ACCEPT, "*/*")
        .build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(int connectMs, int readMs) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(connectMs));
    requestFactory.setReadTimeout(Duration.ofMillis(readMs));
    return requestFactory;
  }
}
