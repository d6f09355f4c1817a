package dev.sitepack.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that canonicalizes URLs for deduplication.
 * Removes fragments, default ports, tracking query params and trailing slashes; lowercases scheme
 * and host; decodes percent-escaped unreserved characters; sorts the remaining query params.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "gclid", "fbclid", "ref", "source"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL to its canonical form:
     * - Remove fragments (#section)
     * - Remove common tracking query params (utm_*, gclid, fbclid, ref, source)
     * - Sort remaining query params
     * - Remove trailing slashes unless the path is just the root
     * - Lowercase scheme and host (path is case-sensitive)
     * - Omit default ports
     * - Decode escapes of unreserved characters ({@code %61} becomes {@code a}) and uppercase
     *   the hex digits of the escapes that remain
     * <p>
     * The result is a fixed point: normalizing it again returns it unchanged.
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.debug("Malformed URL, returning unchanged: {}", url);
            return url;
        }

        // Must have a scheme and host to normalize
        if (uri.getScheme() == null || uri.getHost() == null) {
            log.debug("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = decodeUnreserved(uri.getRawPath());
        String query = decodeUnreserved(uri.getRawQuery());

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String filteredQuery = filterQueryParams(query);

        // Rebuild URL without fragment
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (filteredQuery != null && !filteredQuery.isEmpty()) {
            sb.append('?').append(filteredQuery);
        }

        return sb.toString();
    }

    /**
     * Extract the base URL (scheme://host[:port]) from a full URL.
     * Non-default ports are preserved; default ports (80 for HTTP, 443 for HTTPS) are omitted.
     *
     * @param url the URL to extract the base from
     * @return the base URL, or the input unchanged if malformed
     */
    public static String normalizeToBase(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return url;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if (port == -1 || isDefaultPort(scheme, port)) {
                return scheme + "://" + host;
            }
            return scheme + "://" + host + ":" + port;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    /**
     * Check if a candidate URL has the same scheme+host+port as the root URL.
     * Used to keep the crawl frontier on the target site.
     *
     * @param rootUrl the root URL defining the site boundary
     * @param candidateUrl the URL to check
     * @return true if the candidate is on the same site
     */
    public static boolean isSameSite(String rootUrl, String candidateUrl) {
        try {
            URI root = new URI(rootUrl);
            URI candidate = new URI(candidateUrl);
            if (root.getScheme() == null || candidate.getScheme() == null
                    || root.getHost() == null || candidate.getHost() == null) {
                return false;
            }
        } catch (URISyntaxException e) {
            return false;
        }
        return normalizeToBase(rootUrl).equals(normalizeToBase(candidateUrl));
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT));
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    /**
     * RFC 3986 section 6.2.2: {@code ALPHA / DIGIT / "-" / "." / "_" / "~"} are equivalent whether
     * escaped or not. Reserved escapes such as {@code %2F} keep their meaning and stay encoded.
     */
    static String decodeUnreserved(String raw) {
        if (raw == null || raw.indexOf('%') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '%' && i + 2 < raw.length()
                    && isHex(raw.charAt(i + 1)) && isHex(raw.charAt(i + 2))) {
                char decoded = (char) Integer.parseInt(raw.substring(i + 1, i + 3), 16);
                if (isUnreserved(decoded)) {
                    sb.append(decoded);
                } else {
                    sb.append('%').append(raw.substring(i + 1, i + 3).toUpperCase(Locale.ROOT));
                }
                i += 3;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
