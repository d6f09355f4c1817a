package dev.sitepack.ranking;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.sitepack.inventory.InventoryEntry;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A representative inventory entry with its position in the relevance order. Ranks run 1..n
 * without gaps.
 *
 * @param semanticScore weighted relevance judgment, or null when it was disabled or failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"rank", "score", "category"})
public record RankedEntry(
    @JsonUnwrapped InventoryEntry entry,
    int rank,
    double score,
    double keywordScore,
    @Nullable Double semanticScore,
    List<String> reasons,
    String category) {
  public RankedEntry {
    reasons = List.copyOf(reasons);
  }
}
