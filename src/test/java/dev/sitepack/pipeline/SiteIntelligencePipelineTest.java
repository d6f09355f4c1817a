package dev.sitepack.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.sitepack.compliance.ComplianceGate;
import dev.sitepack.compliance.CompliancePolicy;
import dev.sitepack.crawl.CrawlOrchestrator;
import dev.sitepack.crawl.CrawlOutcome;
import dev.sitepack.crawl.FetchMethod;
import dev.sitepack.crawl.PageRecord;
import dev.sitepack.extraction.DeepExtractionCoordinator;
import dev.sitepack.extraction.ExtractedField;
import dev.sitepack.extraction.ExtractionOutcome;
import dev.sitepack.extraction.ExtractionUnit;
import dev.sitepack.inventory.InventoryBuilder;
import dev.sitepack.llm.ExtractionService;
import dev.sitepack.ranking.RankingProperties;
import dev.sitepack.ranking.RelevanceRanker;
import dev.sitepack.synthesis.Synthesizer;
import dev.sitepack.validation.SchemaValidator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SiteIntelligencePipelineTest {

  private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");
  private static final String DOMAIN = "x.com";

  @Mock private ComplianceGate complianceGate;
  @Mock private CrawlOrchestrator crawlOrchestrator;
  @Mock private DeepExtractionCoordinator extractionCoordinator;
  @Mock private ExtractionService extractionService;
  @Mock private DegradedRunNotifier notifier;

  @TempDir Path root;

  private SiteIntelligencePipeline pipeline;

  @BeforeEach
  void setUp() {
    ObjectMapper mapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    Clock clock = Clock.fixed(AT, ZoneOffset.UTC);
    RankingProperties ranking = new RankingProperties();
    ranking.setSemanticEnabled(false);
    pipeline =
        new SiteIntelligencePipeline(
            complianceGate,
            crawlOrchestrator,
            new InventoryBuilder(),
            new RelevanceRanker(extractionService, ranking),
            extractionCoordinator,
            new Synthesizer(),
            new SchemaValidator(mapper),
            new ArtifactWriter(mapper, new OutputProperties(root, 5), clock),
            notifier,
            clock);
    when(complianceGate.fetchPolicy(DOMAIN))
        .thenReturn(new CompliancePolicy(Set.of("/admin"), true, "https://x.com/robots.txt"));
  }

  private static PageRecord page(String path, String text) {
    return new PageRecord(
        "https://x.com" + path, "Title " + path, text, 200, "root", AT, true, FetchMethod.CRAWL_PROVIDER, null);
  }

  private static ExtractionUnit unit(String path, int rank) {
    return new ExtractionUnit(
        "https://x.com" + path,
        "Title " + path,
        rank,
        "summary",
        Map.of("positioning", new ExtractedField("Value from " + path, List.of("EV_001"))),
        Map.of("EV_001", "Quote from " + path),
        AT,
        false,
        null);
  }

  private void stubCrawl(List<PageRecord> pages, boolean degraded) {
    when(crawlOrchestrator.crawl(eq(DOMAIN), eq(200), any()))
        .thenReturn(
            new CrawlOutcome(
                pages,
                FetchMethod.CRAWL_PROVIDER,
                degraded,
                degraded ? "Only " + pages.size() + " pages retrieved from x.com (minimum 5)" : null,
                0,
                pages.size()));
  }

  private static List<PageRecord> healthyCrawl() {
    return List.of(
        page("/", "home"),
        page("/pricing", "pricing"),
        page("/about", "about"),
        page("/contact", "contact"),
        page("/privacy", "privacy"));
  }

  private static ExtractionOutcome healthyExtraction() {
    return new ExtractionOutcome(
        List.of(unit("/pricing", 1), unit("/about", 2), unit("/contact", 3), unit("/privacy", 4), unit("/", 5)),
        5,
        false,
        null);
  }

  @Test
  void healthyRunWritesPackWithoutNotifying() {
    stubCrawl(healthyCrawl(), false);
    when(extractionCoordinator.extract(anyList(), eq(15))).thenReturn(healthyExtraction());

    RunResult result = pipeline.run(new RunParameters(DOMAIN, 200, 15, true));

    assertThat(result.degraded().degraded()).isFalse();
    assertThat(result.pack().siteMetadata().pagesCrawled()).isEqualTo(5);
    assertThat(result.pack().siteMetadata().pagesExtracted()).isEqualTo(5);
    assertThat(result.pack().siteMetadata().disallowPaths()).containsExactly("/admin");
    assertThat(result.pack().siteMetadata().robotsFetched()).isTrue();
    assertThat(result.pack().claimsByDimension().get("positioning")).hasSize(5);
    assertThat(result.pack().validationWarnings()).isEmpty();
    assertThat(result.artifactDirectory().resolve("site_intelligence_pack.json")).exists();
    verifyNoInteractions(notifier);
  }

  @Test
  void degradedBatchRunNotifies() {
    stubCrawl(List.of(page("/", "home"), page("/pricing", "pricing")), true);
    when(extractionCoordinator.extract(anyList(), eq(15)))
        .thenReturn(new ExtractionOutcome(List.of(unit("/pricing", 1)), 1, true, "Only 1 of 2"));

    RunResult result = pipeline.run(new RunParameters(DOMAIN, 200, 15, true));

    assertThat(result.degraded().degraded()).isTrue();
    assertThat(result.degraded().reasons())
        .containsExactly("Only 2 pages retrieved from x.com (minimum 5)", "Only 1 of 2");
    assertThat(result.pack().siteMetadata().degraded()).isEqualTo(result.degraded());
    verify(notifier).notifyDegraded(DOMAIN, result.degraded(), result.artifactDirectory());
  }

  @Test
  void degradedInteractiveRunOnlyLogs() {
    stubCrawl(List.of(page("/", "home")), true);
    when(extractionCoordinator.extract(anyList(), eq(15)))
        .thenReturn(new ExtractionOutcome(List.of(), 0, true, "Only 0 of 0"));

    RunResult result = pipeline.run(RunParameters.withDefaults(DOMAIN));

    assertThat(result.degraded().degraded()).isTrue();
    assertThat(result.artifactDirectory().resolve("README.md")).exists();
    verifyNoInteractions(notifier);
  }

  @Test
  void evidenceFromPagesOutsideTheInventoryIsFlagged() throws Exception {
    stubCrawl(healthyCrawl(), false);
    when(extractionCoordinator.extract(anyList(), eq(15)))
        .thenReturn(new ExtractionOutcome(List.of(unit("/elsewhere", 1)), 1, true, "Only 1 of 1"));

    RunResult result = pipeline.run(new RunParameters(DOMAIN, 200, 15, false));

    assertThat(result.pack().validationWarnings())
        .containsExactly("Evidence EV_0001 comes from https://x.com/elsewhere, which is not a known page");
    assertThat(Files.readString(result.artifactDirectory().resolve("site_intelligence_pack.json")))
        .contains("\"validation_warnings\"")
        .contains("which is not a known page");
  }

  @Test
  void passesPageBudgetThrough() {
    when(crawlOrchestrator.crawl(eq(DOMAIN), eq(20), any()))
        .thenReturn(new CrawlOutcome(List.of(), FetchMethod.CRAWL_PROVIDER, true, "none", 0, 0));
    when(extractionCoordinator.extract(anyList(), eq(3)))
        .thenReturn(new ExtractionOutcome(List.of(), 0, true, "none"));

    RunResult result = pipeline.run(new RunParameters(DOMAIN, 20, 3, false));

    assertThat(result.pack().claimsByDimension()).allSatisfy((dim, claims) -> assertThat(claims).isEmpty());
    verify(crawlOrchestrator).crawl(eq(DOMAIN), eq(20), any(CompliancePolicy.class));
  }
}
