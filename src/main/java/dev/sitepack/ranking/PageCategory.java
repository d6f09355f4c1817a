package dev.sitepack.ranking;

import java.util.List;
import java.util.Locale;

/** Business-page lexicon used for keyword scoring. Weight doubles as category priority. */
public enum PageCategory {
  PRICING(
      100,
      List.of("pricing", "plans", "price", "cost", "subscription", "buy", "purchase", "offers", "deal"),
      List.of("pricing", "plans", "cost", "buy")),
  PRODUCT(
      80,
      List.of("how-it-works", "features", "product", "solutions", "platform", "technology"),
      List.of("features", "how it works", "product")),
  LEGAL(
      70,
      List.of("privacy", "terms", "policy", "legal", "compliance", "security", "gdpr"),
      List.of("privacy", "terms")),
  TESTIMONIALS(
      65,
      List.of("testimonial", "review", "case-stud", "customer", "success", "story"),
      List.of("testimonials", "reviews", "case studies")),
  ABOUT(
      60,
      List.of("about", "company", "team", "mission", "vision", "who-we-are"),
      List.of("about us", "our team", "company")),
  SUPPORT(
      55,
      List.of("faq", "help", "support", "question", "answer"),
      List.of("faq", "frequently asked")),
  CONTACT(
      50, List.of("contact", "reach", "sales", "demo", "quote"), List.of("contact", "get in touch")),
  BLOG(20, List.of("blog", "news", "article", "post"), List.of());

  public static final String UNCATEGORIZED = "uncategorized";

  private final int weight;
  private final List<String> pathKeywords;
  private final List<String> titleKeywords;

  PageCategory(int weight, List<String> pathKeywords, List<String> titleKeywords) {
    this.weight = weight;
    this.pathKeywords = pathKeywords;
    this.titleKeywords = titleKeywords;
  }

  public int weight() {
    return weight;
  }

  public List<String> pathKeywords() {
    return pathKeywords;
  }

  public List<String> titleKeywords() {
    return titleKeywords;
  }

  /** Contribution cap for this category, however many keywords hit. */
  public double cap() {
    return weight * 1.5;
  }

  /** Lowercase label used in artifacts. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
