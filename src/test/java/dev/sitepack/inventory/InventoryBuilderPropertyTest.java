package dev.sitepack.inventory;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sitepack.crawl.PageRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Dedup invariants that must hold for any crawl: one representative per cluster, and cluster
 * membership independent of the order pages were discovered in.
 */
class InventoryBuilderPropertyTest {

  private final InventoryBuilder builder = new InventoryBuilder();

  @Property(tries = 200)
  void exactlyOneRepresentativePerCluster(@ForAll("crawls") List<PageRecord> pages) {
    List<InventoryEntry> entries = builder.build(pages);

    Map<String, Long> representatives =
        entries.stream()
            .filter(InventoryEntry::representative)
            .collect(Collectors.groupingBy(InventoryEntry::dedupClusterId, Collectors.counting()));
    Set<String> successfulClusters =
        entries.stream()
            .filter(e -> !e.contentHash().isEmpty())
            .map(InventoryEntry::dedupClusterId)
            .collect(Collectors.toSet());

    assertThat(representatives.keySet()).isEqualTo(successfulClusters);
    assertThat(representatives.values()).allMatch(count -> count == 1L);
  }

  @Property(tries = 200)
  void clusterMembershipIgnoresDiscoveryOrder(
      @ForAll("crawls") List<PageRecord> pages, @ForAll long seed) {
    List<PageRecord> shuffled = new ArrayList<>(pages);
    Collections.shuffle(shuffled, new Random(seed));

    assertThat(clustersOf(builder.build(shuffled))).isEqualTo(clustersOf(builder.build(pages)));
  }

  /** Cluster ID to the set of page URLs in it, successful pages only. */
  private static Map<String, Set<String>> clustersOf(List<InventoryEntry> entries) {
    Map<String, Set<String>> clusters = new HashMap<>();
    for (InventoryEntry entry : entries) {
      if (!entry.contentHash().isEmpty()) {
        clusters.computeIfAbsent(entry.dedupClusterId(), k -> new HashSet<>()).add(entry.url());
      }
    }
    return clusters;
  }

  @Provide
  Arbitrary<List<PageRecord>> crawls() {
    Arbitrary<String> url =
        Combinators.combine(
                Arbitraries.of("/a", "/b", "/pricing", "/about"),
                Arbitraries.of("", "/", "?utm_source=x", "#frag", "?v=1"))
            .as((path, suffix) -> "https://x.com" + path + suffix);
    Arbitrary<String> text = Arbitraries.of("alpha", "beta", "beta ", "gamma", "delta");
    Arbitrary<PageRecord> page =
        Combinators.combine(url, text, Arbitraries.integers().between(0, 9))
            .as((u, t, roll) -> roll == 0 ? PageRecords.failed(u, 500, "HTTP 500") : PageRecords.ok(u, t));
    return page.list().ofMaxSize(12).uniqueElements(PageRecord::url);
  }
}
