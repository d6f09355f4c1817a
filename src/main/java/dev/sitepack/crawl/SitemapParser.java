package dev.sitepack.crawl;

import java.net.URI;
import java.net.URL;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import dev.sitepack.compliance.CompliancePolicy;

/**
 * Parses sitemap.xml from well-known locations using crawler-commons.
 * Handles both single sitemaps and sitemap index files.
 *
 * <p>Every sitemap request, nested ones included, is checked against the robots policy, waits
 * for a permit from the crawl's {@link RateLimitGate}, and is skipped once the crawl deadline
 * has passed.
 */
@Component
public class SitemapParser {

    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

    private final RestClient restClient;
    private final long maxSitemapSizeBytes;
    private final Clock clock;

    public SitemapParser(@Qualifier("sitemapRestClient") RestClient restClient,
                         CrawlProperties props, Clock clock) {
        this.restClient = restClient;
        this.maxSitemapSizeBytes = props.maxSitemapSizeBytes();
        this.clock = clock;
    }

    /**
     * Try to discover page URLs from sitemap.xml or sitemap_index.xml on the site.
     * Returns an empty list if no sitemap is found or none can be parsed.
     *
     * @param rootUrl  root page of the site
     * @param policy   robots policy; disallowed sitemap URLs are never requested
     * @param gate     the crawl's shared rate gate
     * @param deadline no sitemap request starts at or after this instant
     */
    public List<String> discoverFromSitemap(String rootUrl, CompliancePolicy policy,
                                            RateLimitGate gate, Instant deadline) {
        String baseUrl = UrlNormalizer.normalizeToBase(rootUrl);
        List<String> candidates = List.of(
                baseUrl + "/sitemap.xml",
                baseUrl + "/sitemap_index.xml"
        );

        for (String sitemapUrl : candidates) {
            try {
                byte[] content = fetchSitemap(sitemapUrl, policy, gate, deadline);
                if (content == null) {
                    continue;
                }

                AbstractSiteMap result = new crawlercommons.sitemaps.SiteMapParser(false)
                        .parseSiteMap(content, URI.create(sitemapUrl).toURL());

                if (result instanceof SiteMapIndex index) {
                    List<String> urls = new ArrayList<>();
                    for (AbstractSiteMap nested : index.getSitemaps()) {
                        urls.addAll(parseSingleSitemap(nested.getUrl().toString(), policy, gate, deadline));
                    }
                    log.info("Sitemap index {} listed {} URLs", sitemapUrl, urls.size());
                    return urls;
                } else if (result instanceof SiteMap siteMap) {
                    List<String> urls = extractUrls(siteMap);
                    log.info("Sitemap {} listed {} URLs", sitemapUrl, urls.size());
                    return urls;
                }
            } catch (Exception e) {
                log.debug("Sitemap not available at {}: {}", sitemapUrl, e.getMessage());
            }
        }
        return List.of();
    }

    /**
     * Fetch sitemap content with size limit to prevent OOM on giant sitemaps.
     * Returns null without a request when robots.txt disallows the URL or the deadline has passed.
     */
    private byte[] fetchSitemap(String sitemapUrl, CompliancePolicy policy,
                                RateLimitGate gate, Instant deadline) {
        if (!policy.isAllowed(sitemapUrl)) {
            log.debug("Sitemap blocked by robots.txt: {}", sitemapUrl);
            return null;
        }
        if (!clock.instant().isBefore(deadline)) {
            log.debug("Crawl deadline passed, skipping sitemap {}", sitemapUrl);
            return null;
        }
        gate.pace();
        byte[] content = restClient.get()
                .uri(sitemapUrl)
                .retrieve()
                .body(byte[].class);
        if (content == null || content.length == 0) {
            return null;
        }
        if (content.length > maxSitemapSizeBytes) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes > {} bytes), skipping",
                    sitemapUrl, content.length, maxSitemapSizeBytes);
            return null;
        }
        return content;
    }

    private List<String> parseSingleSitemap(String sitemapUrl, CompliancePolicy policy,
                                            RateLimitGate gate, Instant deadline) {
        try {
            byte[] content = fetchSitemap(sitemapUrl, policy, gate, deadline);
            if (content == null) {
                return List.of();
            }

            AbstractSiteMap result = new crawlercommons.sitemaps.SiteMapParser(false)
                    .parseSiteMap(content, URI.create(sitemapUrl).toURL());

            if (result instanceof SiteMap siteMap) {
                return extractUrls(siteMap);
            }
        } catch (Exception e) {
            log.debug("Could not parse sub-sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
