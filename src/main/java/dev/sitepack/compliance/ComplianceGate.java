package dev.sitepack.compliance;

import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches and parses a domain's robots.txt into a {@link CompliancePolicy}.
 *
 * <p>Fail-open: a missing file, an error status, a timeout, or an unparseable body all produce
 * an allow-all policy with {@code fetched = false}. This gate never throws and never blocks the
 * crawl.
 */
@Service
public class ComplianceGate {

  private static final Logger log = LoggerFactory.getLogger(ComplianceGate.class);

  private final RestClient restClient;
  private final String robotName;

  public ComplianceGate(
      @Qualifier("complianceRestClient") RestClient restClient,
      @Value("${sitepack.crawl.robot-name:sitepack}") String robotName) {
    this.restClient = restClient;
    this.robotName = robotName.toLowerCase(Locale.ROOT);
  }

  /**
   * Retrieve the exclusion policy for a domain.
   *
   * @param domain bare domain name, e.g. {@code example.com}
   * @return the parsed policy, or an allow-all policy if robots.txt could not be used
   */
  public CompliancePolicy fetchPolicy(String domain) {
    String robotsUrl = "https://" + domain + "/robots.txt";

    byte[] content;
    try {
      content = restClient.get().uri(robotsUrl).retrieve().body(byte[].class);
    } catch (RestClientException e) {
      log.debug("robots.txt unavailable at {}: {}", robotsUrl, e.getMessage());
      return CompliancePolicy.allowAll(robotsUrl);
    }

    if (content == null || content.length == 0) {
      log.info("Empty robots.txt at {}, no restrictions", robotsUrl);
      return new CompliancePolicy(Set.of(), true, robotsUrl);
    }

    try {
      SimpleRobotRules rules =
          new SimpleRobotRulesParser()
              .parseContent(robotsUrl, content, "text/plain", List.of(robotName));
      Set<String> disallowed = new TreeSet<>();
      if (rules.isAllowNone()) {
        disallowed.add("/");
      }
      for (SimpleRobotRules.RobotRule rule : rules.getRobotRules()) {
        if (!rule.isAllow() && !rule.getPrefix().isEmpty()) {
          disallowed.add(rule.getPrefix());
        }
      }
      log.info("Parsed robots.txt at {}: {} disallowed paths", robotsUrl, disallowed.size());
      return new CompliancePolicy(disallowed, true, robotsUrl);
    } catch (RuntimeException e) {
      log.warn("Could not parse robots.txt at {}: {}", robotsUrl, e.getMessage());
      return CompliancePolicy.allowAll(robotsUrl);
    }
  }
}
