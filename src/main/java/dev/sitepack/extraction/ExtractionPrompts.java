package dev.sitepack.extraction;

import java.util.List;

/** Prompt text and dimension names for deep extraction. */
public final class ExtractionPrompts {

  /** Business dimensions every page is asked about, in report order. */
  public static final List<String> KNOWN_DIMENSIONS =
      List.of(
          "positioning",
          "offers_and_pricing",
          "customer_journey",
          "trust_signals",
          "compliance_and_policies");

  static final String DEEP_EXTRACT =
      """
      Extract structured business intelligence from the page content.

      Rules:
      1. Every field MUST cite evidence IDs (EV_001, EV_002, ...) defined in "evidence".
      2. Evidence excerpts MUST be quoted verbatim from the content, 50-150 characters.
      3. If a dimension is not covered by the page, omit it. Do not guess.
      4. Return ONLY one JSON object.

      Dimensions:
      - positioning: who the company is, what it offers, and for whom
      - offers_and_pricing: products, plans, prices, billing terms, guarantees
      - customer_journey: how a customer discovers, buys, onboards and gets support
      - trust_signals: testimonials, customer logos, certifications, reviews
      - compliance_and_policies: privacy, terms, refunds, cancellations, regulatory claims
      Other dimensions may be added if the page clearly supports them.

      Response shape:
      {
        "summary": "Brief page summary (2-3 sentences)",
        "fields": {
          "positioning": {"value": "...", "evidence": ["EV_001"]}
        },
        "evidence": {
          "EV_001": {"excerpt": "exact quote from content"}
        }
      }
      """;

  private ExtractionPrompts() {
    // constants
  }
}
