package dev.sitepack.crawl;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Reduced-capability fetcher used once the crawl provider is down: a plain GET plus jsoup
 * parsing. No script execution, so client-rendered pages come back thin.
 */
@Service
public class HttpFallbackFetcher implements PageFetcher {

  private static final Logger log = LoggerFactory.getLogger(HttpFallbackFetcher.class);

  private static final String STRIPPED_ELEMENTS = "script, style, nav, footer, noscript";

  private final RestClient restClient;
  private final int maxContentChars;

  public HttpFallbackFetcher(
      @Qualifier("fallbackRestClient") RestClient restClient, CrawlProperties props) {
    this.restClient = restClient;
    this.maxContentChars = props.fallbackMaxContentChars();
  }

  @Override
  public CrawlResult fetch(String url) {
    ResponseEntity<String> response;
    try {
      response = restClient.get().uri(url).retrieve().toEntity(String.class);
    } catch (RestClientResponseException e) {
      log.debug("Fallback fetch of {} returned HTTP {}", url, e.getStatusCode().value());
      return CrawlResult.failure(url, e.getStatusCode().value(), "HTTP " + e.getStatusCode().value());
    } catch (RestClientException e) {
      log.debug("Fallback fetch of {} failed: {}", url, e.getMessage());
      return CrawlResult.failure(url, 0, e.getMessage());
    }

    int status = response.getStatusCode().value();
    MediaType contentType = response.getHeaders().getContentType();
    if (!isHtml(contentType)) {
      return CrawlResult.failure(url, status, "Skipped non-HTML content: " + contentType);
    }
    String html = response.getBody();
    if (html == null || html.isBlank()) {
      return CrawlResult.failure(url, status, "Empty response body");
    }

    Document doc = Jsoup.parse(html, url);
    String title = doc.title().isBlank() ? null : doc.title().trim();
    List<String> links = extractLinks(doc);

    doc.select(STRIPPED_ELEMENTS).remove();
    String text = doc.body() != null ? doc.body().text() : doc.text();
    if (text.length() > maxContentChars) {
      text = text.substring(0, maxContentChars);
    }

    return new CrawlResult(url, title, text, status, links, true, null);
  }

  @Override
  public FetchMethod method() {
    return FetchMethod.HTTP_FALLBACK;
  }

  private static boolean isHtml(MediaType contentType) {
    if (contentType == null) {
      return false;
    }
    return MediaType.TEXT_HTML.isCompatibleWith(contentType)
        || MediaType.APPLICATION_XHTML_XML.isCompatibleWith(contentType);
  }

  private static List<String> extractLinks(Document doc) {
    Set<String> links = new LinkedHashSet<>();
    for (Element anchor : doc.select("a[href]")) {
      String href = anchor.absUrl("href");
      if (!href.isBlank()) {
        links.add(href);
      }
    }
    return List.copyOf(links);
  }
}
