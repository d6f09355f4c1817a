package dev.sitepack.pipeline;

import dev.sitepack.synthesis.Claim;
import dev.sitepack.synthesis.IntelligencePack;
import dev.sitepack.synthesis.SiteMetadata;
import java.util.List;
import java.util.Map;

/** Renders the human-readable README.md that accompanies each run's artifacts. */
final class ReadmeRenderer {

  private ReadmeRenderer() {}

  static String render(IntelligencePack pack, int claimsPerDimension) {
    SiteMetadata meta = pack.siteMetadata();
    StringBuilder md = new StringBuilder();
    md.append("# Site Intelligence Pack: ").append(meta.domain()).append("\n\n");
    md.append("Generated: ").append(meta.generatedAt()).append("\n\n");

    md.append("## Summary\n\n");
    md.append("Crawled ")
        .append(meta.pagesCrawled())
        .append(" pages via ")
        .append(meta.crawlMethod())
        .append(", extracted ")
        .append(meta.pagesExtracted())
        .append(" pages, ")
        .append(pack.evidenceIndex().size())
        .append(" evidence entries.\n");
    if (meta.degraded().degraded()) {
      md.append("\n**Degraded run:**\n\n");
      for (String reason : meta.degraded().reasons()) {
        md.append("- ").append(reason).append('\n');
      }
    }

    md.append("\n## Key Findings\n");
    for (Map.Entry<String, List<Claim>> dimension : pack.claimsByDimension().entrySet()) {
      md.append("\n### ").append(headingFor(dimension.getKey())).append("\n\n");
      List<Claim> claims = dimension.getValue();
      if (claims.isEmpty()) {
        md.append("- No findings\n");
        continue;
      }
      for (Claim claim : claims.subList(0, Math.min(claimsPerDimension, claims.size()))) {
        md.append("- ")
            .append(claim.statement().replace('\n', ' '))
            .append(" (")
            .append(String.join(", ", claim.evidenceRefs()))
            .append(")\n");
      }
    }

    if (!pack.unknownsAndGaps().isEmpty()) {
      md.append("\n## Unknowns and Gaps\n\n");
      pack.unknownsAndGaps().forEach(gap -> md.append("- ").append(gap).append('\n'));
    }
    if (!pack.validationWarnings().isEmpty()) {
      md.append("\n## Validation Warnings\n\n");
      pack.validationWarnings().forEach(w -> md.append("- ").append(w).append('\n'));
    }

    md.append("\n## Files\n\n");
    md.append("- `inventory.json`: full page inventory\n");
    md.append("- `ranked_pages.json`: relevance-ranked pages\n");
    md.append("- `deep_extract.json`: structured extractions\n");
    md.append("- `site_intelligence_pack.json`: final intelligence pack with evidence\n");
    return md.toString();
  }

  private static String headingFor(String dimension) {
    String spaced = dimension.replace('_', ' ');
    return spaced.isEmpty() ? spaced : Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
  }
}
