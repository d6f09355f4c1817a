package dev.sitepack.inventory;

import static dev.sitepack.inventory.PageRecords.failed;
import static dev.sitepack.inventory.PageRecords.ok;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class InventoryBuilderTest {

  private final InventoryBuilder builder = new InventoryBuilder();

  @Test
  void trailingSlashVariantsWithSameContentFormOneCluster() {
    List<InventoryEntry> entries =
        builder.build(List.of(ok("https://x.com/a", "Same text"), ok("https://x.com/a/", "Same text")));

    assertThat(entries).hasSize(2);
    assertThat(entries).extracting(InventoryEntry::dedupClusterId).containsOnly(entries.get(0).dedupClusterId());
    assertThat(entries).extracting(InventoryEntry::clusterSize).containsOnly(2);
    assertThat(entries).filteredOn(InventoryEntry::representative).hasSize(1);
    assertThat(entries.get(0).representative()).isTrue();
    assertThat(entries.get(1).notes()).isEqualTo("duplicate of https://x.com/a");
  }

  @Test
  void sameContentUnderDifferentUrlsJoinsOneCluster() {
    List<InventoryEntry> entries =
        builder.build(
            List.of(
                ok("https://x.com/pricing-and-plans", "Pro costs 10"),
                ok("https://x.com/pricing", "Pro   costs\n10"),
                ok("https://x.com/about", "We are x")));

    InventoryEntry long1 = entries.get(0);
    InventoryEntry short1 = entries.get(1);
    assertThat(long1.dedupClusterId()).isEqualTo(short1.dedupClusterId());
    assertThat(long1.canonicalUrl()).isNotEqualTo(short1.canonicalUrl());
    assertThat(short1.representative()).isTrue();
    assertThat(long1.representative()).isFalse();
    assertThat(entries.get(2).dedupClusterId()).isNotEqualTo(short1.dedupClusterId());
    assertThat(entries.get(2).clusterSize()).isEqualTo(1);
  }

  @Test
  void canonicalAndContentMatchesMergeTransitively() {
    List<InventoryEntry> entries =
        builder.build(
            List.of(
                ok("https://x.com/a", "version one"),
                ok("https://x.com/a?utm_source=mail", "version two"),
                ok("https://x.com/b", "version two")));

    assertThat(entries).extracting(InventoryEntry::dedupClusterId).containsOnly(entries.get(0).dedupClusterId());
    assertThat(entries).filteredOn(InventoryEntry::representative).hasSize(1);
  }

  @Test
  void representativeTieOnLengthGoesToEarliestDiscovery() {
    List<InventoryEntry> entries =
        builder.build(List.of(ok("https://x.com/bb", "dup"), ok("https://x.com/aa", "dup")));

    assertThat(entries.get(0).representative()).isTrue();
    assertThat(entries.get(1).representative()).isFalse();
  }

  @Test
  void clusterIdComesFromContentHash() {
    List<InventoryEntry> entries = builder.build(List.of(ok("https://x.com/a", "hello")));

    assertThat(entries.get(0).contentHash()).isEqualTo(ContentHasher.fingerprint("hello"));
    assertThat(entries.get(0).dedupClusterId())
        .isEqualTo("cluster_" + ContentHasher.fingerprint("hello").substring(0, 12));
  }

  @Test
  void failedFetchesAreSingletonNonRepresentatives() {
    List<InventoryEntry> entries =
        builder.build(
            List.of(
                ok("https://x.com/", "home"),
                failed("https://x.com/gone", 404, "HTTP 404"),
                failed("https://x.com/gone2", 500, "HTTP 500")));

    InventoryEntry gone = entries.get(1);
    assertThat(gone.representative()).isFalse();
    assertThat(gone.contentHash()).isEmpty();
    assertThat(gone.httpStatus()).isEqualTo(404);
    assertThat(gone.notes()).isEqualTo("HTTP 404");
    assertThat(gone.clusterSize()).isEqualTo(1);
    assertThat(gone.dedupClusterId()).isNotEqualTo(entries.get(2).dedupClusterId());
    assertThat(gone.content()).isNull();
  }

  @Test
  void failedFetchNeverJoinsSuccessfulCluster() {
    List<InventoryEntry> entries =
        builder.build(
            List.of(ok("https://x.com/a", "text"), failed("https://x.com/a/", 503, "HTTP 503")));

    assertThat(entries.get(0).clusterSize()).isEqualTo(1);
    assertThat(entries.get(0).representative()).isTrue();
    assertThat(entries.get(1).dedupClusterId()).isNotEqualTo(entries.get(0).dedupClusterId());
  }

  @Test
  void preservesDiscoveryOrderAndCarriesContent() {
    List<InventoryEntry> entries =
        builder.build(List.of(ok("https://x.com/z", "last"), ok("https://x.com/a", "first")));

    assertThat(entries).extracting(InventoryEntry::url).containsExactly("https://x.com/z", "https://x.com/a");
    assertThat(entries).extracting(InventoryEntry::discoveryIndex).containsExactly(0, 1);
    assertThat(entries.get(0).content()).isEqualTo("last");
  }

  @Test
  void emptyInputGivesEmptyInventory() {
    assertThat(builder.build(List.of())).isEmpty();
  }
}
