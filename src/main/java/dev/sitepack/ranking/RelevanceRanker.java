package dev.sitepack.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sitepack.inventory.InventoryEntry;
import dev.sitepack.llm.ExtractionService;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores representative inventory entries and puts them in a total order.
 *
 * <p>score = keyword score (path and title hits against {@link PageCategory}, capped per
 * category) + semantic score (relevance judgment from the extraction service over a content
 * preview, times the configured weight). Ties break by shorter canonical URL, then earlier
 * discovery. A failed judgment leaves the page on its keyword score alone.
 */
@Service
public class RelevanceRanker {

  private static final Logger log = LoggerFactory.getLogger(RelevanceRanker.class);

  static final String RELEVANCE_PROMPT =
      """
      You judge how useful a web page is for understanding a business: what it sells, \
      to whom, at what price, how customers buy, and why they should trust it.
      Read the page excerpt and answer with a single JSON object and nothing else:
      {"relevance": <number between 0 and 1>, "reason": "<one short sentence>"}
      """;

  private static final Comparator<RankedEntry> ORDER =
      Comparator.comparingDouble(RankedEntry::score)
          .reversed()
          .thenComparingInt(r -> r.entry().canonicalUrl().length())
          .thenComparingInt(r -> r.entry().discoveryIndex());

  private final ExtractionService extractionService;
  private final RankingProperties properties;

  public RelevanceRanker(ExtractionService extractionService, RankingProperties properties) {
    this.extractionService = extractionService;
    this.properties = properties;
  }

  /**
   * Rank the representative entries of an inventory. Non-representative and failed entries are
   * ignored.
   */
  public List<RankedEntry> rank(List<InventoryEntry> inventory) {
    List<RankedEntry> scored = new ArrayList<>();
    for (InventoryEntry entry : inventory) {
      if (entry.representative()) {
        scored.add(score(entry));
      }
    }
    scored.sort(ORDER);

    List<RankedEntry> ranked = new ArrayList<>(scored.size());
    for (int i = 0; i < scored.size(); i++) {
      RankedEntry r = scored.get(i);
      ranked.add(
          new RankedEntry(
              r.entry(), i + 1, r.score(), r.keywordScore(), r.semanticScore(), r.reasons(),
              r.category()));
    }
    log.info("Ranked {} representative pages out of {} inventory entries", ranked.size(), inventory.size());
    return List.copyOf(ranked);
  }

  private RankedEntry score(InventoryEntry entry) {
    List<String> reasons = new ArrayList<>();
    String path = pathOf(entry.canonicalUrl());
    String title = entry.title() == null ? "" : entry.title().toLowerCase(Locale.ROOT);

    double keywordScore = 0;
    PageCategory best = null;
    for (PageCategory category : PageCategory.values()) {
      double contribution = 0;
      for (String keyword : category.pathKeywords()) {
        if (path.contains(keyword)) {
          contribution += category.weight();
          reasons.add("Path contains '" + keyword + "'");
        }
      }
      for (String keyword : category.titleKeywords()) {
        if (title.contains(keyword)) {
          contribution += category.weight() + 10;
          reasons.add("Title contains '" + keyword + "'");
        }
      }
      if (contribution > 0) {
        keywordScore += Math.min(contribution, category.cap());
        if (best == null || category.weight() > best.weight()) {
          best = category;
        }
      }
    }

    Double semanticScore = properties.isSemanticEnabled() ? semanticScore(entry, reasons) : null;
    if (reasons.isEmpty()) {
      reasons.add("No keyword match");
    }
    double total = keywordScore + (semanticScore == null ? 0 : semanticScore);
    return new RankedEntry(
        entry,
        0,
        total,
        keywordScore,
        semanticScore,
        reasons,
        best == null ? PageCategory.UNCATEGORIZED : best.label());
  }

  private @Nullable Double semanticScore(InventoryEntry entry, List<String> reasons) {
    String content = entry.content();
    if (content == null || content.isBlank()) {
      return null;
    }
    String preview =
        content.length() > properties.getPreviewChars()
            ? content.substring(0, properties.getPreviewChars())
            : content;
    try {
      ObjectNode judgment = extractionService.extract(RELEVANCE_PROMPT, preview);
      JsonNode relevance = judgment.get("relevance");
      if (relevance == null || !relevance.isNumber()) {
        log.warn("Relevance judgment for {} has no numeric relevance", entry.canonicalUrl());
        return null;
      }
      double clamped = Math.max(0.0, Math.min(1.0, relevance.asDouble()));
      String why = judgment.path("reason").asText("");
      reasons.add(
          String.format(Locale.ROOT, "Semantic relevance %.2f%s", clamped, why.isBlank() ? "" : ": " + why));
      return clamped * properties.getSemanticWeight();
    } catch (RuntimeException e) {
      log.warn("Semantic scoring failed for {}: {}", entry.canonicalUrl(), e.getMessage());
      return null;
    }
  }

  private static String pathOf(String canonicalUrl) {
    try {
      URI uri = URI.create(canonicalUrl);
      String path = uri.getRawPath() == null ? "" : uri.getRawPath();
      String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
      return (path + query).toLowerCase(Locale.ROOT);
    } catch (IllegalArgumentException e) {
      return canonicalUrl.toLowerCase(Locale.ROOT);
    }
  }
}
