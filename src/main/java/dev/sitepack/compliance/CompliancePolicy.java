package dev.sitepack.compliance;

import crawlercommons.robots.SimpleRobotRules;
import java.net.URI;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exclusion policy for one domain, derived from its robots.txt.
 *
 * <p>Only disallow rules are kept; allow lines do not re-open a disallowed path. Matching is
 * done by crawler-commons, which normalizes percent-encoding on both sides and supports the
 * {@code *} wildcard and the {@code $} end anchor.
 */
public final class CompliancePolicy {

  private final Set<String> disallowPaths;
  private final boolean fetched;
  private final String sourceUrl;
  private final SimpleRobotRules rules;

  /**
   * @param disallowPaths robots rules that must not be fetched
   * @param fetched whether robots.txt was actually retrieved; false means fail-open
   * @param sourceUrl the robots.txt URL that was consulted
   */
  public CompliancePolicy(Set<String> disallowPaths, boolean fetched, String sourceUrl) {
    this.disallowPaths =
        disallowPaths == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(disallowPaths));
    this.fetched = fetched;
    this.sourceUrl = sourceUrl;
    this.rules = new SimpleRobotRules();
    for (String path : this.disallowPaths) {
      if (!path.isEmpty()) {
        rules.addRule(path, false);
      }
    }
    rules.sortRules();
  }

  /**
   * Policy used when robots.txt is absent or unreachable: nothing is restricted.
   *
   * @param sourceUrl the robots.txt URL that was attempted
   * @return an allow-all policy with {@code fetched = false}
   */
  public static CompliancePolicy allowAll(String sourceUrl) {
    return new CompliancePolicy(Set.of(), false, sourceUrl);
  }

  /**
   * Check whether a URL may be fetched under this policy.
   *
   * @param url absolute URL of the candidate page
   * @return false if any disallow rule matches the URL's path and query, or the URL is malformed
   */
  public boolean isAllowed(String url) {
    if (disallowPaths.isEmpty()) {
      return true;
    }
    try {
      URI.create(url);
    } catch (IllegalArgumentException e) {
      return false;
    }
    return rules.isAllowed(url);
  }

  /** Disallow rules, sorted and immutable. */
  public Set<String> disallowPaths() {
    return disallowPaths;
  }

  public boolean fetched() {
    return fetched;
  }

  public String sourceUrl() {
    return sourceUrl;
  }

  @Override
  public String toString() {
    return "CompliancePolicy[sourceUrl=" + sourceUrl + ", fetched=" + fetched
        + ", disallowPaths=" + disallowPaths + "]";
  }
}
