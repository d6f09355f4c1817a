package dev.sitepack.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * One crawled page after canonicalization and duplicate clustering. The page text rides along in
 * memory for ranking and extraction but is never written out.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InventoryEntry(
    String url,
    String canonicalUrl,
    @Nullable String title,
    String contentHash,
    String dedupClusterId,
    int httpStatus,
    @Nullable String notes,
    boolean representative,
    int clusterSize,
    int discoveryIndex,
    String discoveredFrom,
    @JsonIgnore @Nullable String content) {}
