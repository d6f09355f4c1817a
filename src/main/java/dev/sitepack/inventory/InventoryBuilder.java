package dev.sitepack.inventory;

import dev.sitepack.crawl.PageRecord;
import dev.sitepack.crawl.UrlNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw page records into inventory entries: canonical URL, content fingerprint, duplicate
 * cluster, and one representative per cluster.
 *
 * <p>Two successful pages land in the same cluster when their canonical URLs are equal or their
 * content hashes are equal, transitively. The representative is the member with the shortest
 * canonical URL, then the earliest discovery. Cluster IDs derive from content, so crawl order
 * does not change them. Failed fetches become singleton, non-representative entries.
 */
@Service
public class InventoryBuilder {

  private static final Logger log = LoggerFactory.getLogger(InventoryBuilder.class);

  private static final int CLUSTER_HASH_PREFIX = 12;

  public List<InventoryEntry> build(List<PageRecord> pages) {
    int n = pages.size();
    String[] canonical = new String[n];
    String[] hashes = new String[n];
    UnionFind clusters = new UnionFind(n);
    Map<String, Integer> firstByCanonical = new HashMap<>();
    Map<String, Integer> firstByHash = new HashMap<>();

    for (int i = 0; i < n; i++) {
      PageRecord page = pages.get(i);
      canonical[i] = UrlNormalizer.normalize(page.url());
      if (!page.success()) {
        hashes[i] = "";
        continue;
      }
      hashes[i] = ContentHasher.fingerprint(page.rawContent());
      Integer sameUrl = firstByCanonical.putIfAbsent(canonical[i], i);
      if (sameUrl != null) {
        clusters.union(sameUrl, i);
      }
      Integer sameHash = firstByHash.putIfAbsent(hashes[i], i);
      if (sameHash != null) {
        clusters.union(sameHash, i);
      }
    }

    Map<Integer, List<Integer>> members = new HashMap<>();
    for (int i = 0; i < n; i++) {
      if (pages.get(i).success()) {
        members.computeIfAbsent(clusters.find(i), k -> new ArrayList<>()).add(i);
      }
    }

    String[] clusterIds = new String[n];
    int[] representativeOf = new int[n];
    int[] sizes = new int[n];
    for (List<Integer> group : members.values()) {
      String smallestHash =
          group.stream().map(i -> hashes[i]).min(Comparator.naturalOrder()).orElseThrow();
      int representative =
          group.stream()
              .min(
                  Comparator.<Integer>comparingInt(i -> canonical[i].length())
                      .thenComparing(i -> i))
              .orElseThrow();
      String clusterId = "cluster_" + smallestHash.substring(0, CLUSTER_HASH_PREFIX);
      for (int i : group) {
        clusterIds[i] = clusterId;
        representativeOf[i] = representative;
        sizes[i] = group.size();
      }
    }

    List<InventoryEntry> entries = new ArrayList<>(n);
    int failed = 0;
    for (int i = 0; i < n; i++) {
      PageRecord page = pages.get(i);
      if (!page.success()) {
        failed++;
        entries.add(
            new InventoryEntry(
                page.url(),
                canonical[i],
                page.title(),
                "",
                String.format("cluster_failed_%04d", failed),
                page.httpStatus(),
                page.errorMessage() != null ? page.errorMessage() : "fetch failed",
                false,
                1,
                i,
                page.discoveredFrom(),
                null));
        continue;
      }
      boolean isRepresentative = representativeOf[i] == i;
      String notes =
          isRepresentative ? null : "duplicate of " + pages.get(representativeOf[i]).url();
      entries.add(
          new InventoryEntry(
              page.url(),
              canonical[i],
              page.title(),
              hashes[i],
              clusterIds[i],
              page.httpStatus(),
              notes,
              isRepresentative,
              sizes[i],
              i,
              page.discoveredFrom(),
              page.rawContent()));
    }

    log.info(
        "Inventory built: {} entries, {} clusters, {} failed fetches",
        entries.size(),
        members.size(),
        failed);
    return List.copyOf(entries);
  }

  /** Disjoint-set forest over page indexes. */
  private static final class UnionFind {

    private final int[] parent;

    UnionFind(int size) {
      parent = new int[size];
      for (int i = 0; i < size; i++) {
        parent[i] = i;
      }
    }

    int find(int i) {
      while (parent[i] != i) {
        parent[i] = parent[parent[i]];
        i = parent[i];
      }
      return i;
    }

    void union(int a, int b) {
      int rootA = find(a);
      int rootB = find(b);
      if (rootA != rootB) {
        parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
      }
    }
  }
}
