package dev.sitepack.pipeline;

import dev.sitepack.compliance.ComplianceGate;
import dev.sitepack.compliance.CompliancePolicy;
import dev.sitepack.crawl.CrawlOrchestrator;
import dev.sitepack.crawl.CrawlOutcome;
import dev.sitepack.extraction.DeepExtractionCoordinator;
import dev.sitepack.extraction.ExtractionOutcome;
import dev.sitepack.inventory.InventoryBuilder;
import dev.sitepack.inventory.InventoryEntry;
import dev.sitepack.ranking.RankedEntry;
import dev.sitepack.ranking.RelevanceRanker;
import dev.sitepack.synthesis.DegradedSignal;
import dev.sitepack.synthesis.IntelligencePack;
import dev.sitepack.synthesis.SiteMetadata;
import dev.sitepack.synthesis.Synthesizer;
import dev.sitepack.validation.SchemaValidator;
import dev.sitepack.validation.ValidationReport;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one domain end to end: compliance, crawl, inventory, ranking, deep extraction, synthesis,
 * validation, artifacts. Stage failures inside the run degrade the output instead of aborting
 * it; only an artifact write failure escapes.
 */
@Service
public class SiteIntelligencePipeline {

  private static final Logger log = LoggerFactory.getLogger(SiteIntelligencePipeline.class);

  private final ComplianceGate complianceGate;
  private final CrawlOrchestrator crawlOrchestrator;
  private final InventoryBuilder inventoryBuilder;
  private final RelevanceRanker relevanceRanker;
  private final DeepExtractionCoordinator extractionCoordinator;
  private final Synthesizer synthesizer;
  private final SchemaValidator schemaValidator;
  private final ArtifactWriter artifactWriter;
  private final DegradedRunNotifier notifier;
  private final Clock clock;

  public SiteIntelligencePipeline(
      ComplianceGate complianceGate,
      CrawlOrchestrator crawlOrchestrator,
      InventoryBuilder inventoryBuilder,
      RelevanceRanker relevanceRanker,
      DeepExtractionCoordinator extractionCoordinator,
      Synthesizer synthesizer,
      SchemaValidator schemaValidator,
      ArtifactWriter artifactWriter,
      DegradedRunNotifier notifier,
      Clock clock) {
    this.complianceGate = complianceGate;
    this.crawlOrchestrator = crawlOrchestrator;
    this.inventoryBuilder = inventoryBuilder;
    this.relevanceRanker = relevanceRanker;
    this.extractionCoordinator = extractionCoordinator;
    this.synthesizer = synthesizer;
    this.schemaValidator = schemaValidator;
    this.artifactWriter = artifactWriter;
    this.notifier = notifier;
    this.clock = clock;
  }

  public RunResult run(RunParameters params) {
    String domain = params.domain();
    log.info(
        "Starting run for {} (page budget={}, deep extract={}, batch={})",
        domain,
        params.pageBudget(),
        params.deepExtractCount(),
        params.batch());

    CompliancePolicy policy = complianceGate.fetchPolicy(domain);
    CrawlOutcome crawl = crawlOrchestrator.crawl(domain, params.pageBudget(), policy);
    List<InventoryEntry> inventory = inventoryBuilder.build(crawl.pages());
    List<RankedEntry> ranked = relevanceRanker.rank(inventory);
    ExtractionOutcome extraction = extractionCoordinator.extract(ranked, params.deepExtractCount());

    DegradedSignal signal = DegradedSignal.of(crawl.degradedReason(), extraction.degradedReason());
    SiteMetadata metadata =
        new SiteMetadata(
            domain,
            "https://" + domain + "/",
            clock.instant(),
            policy.fetched(),
            new ArrayList<>(policy.disallowPaths()),
            crawl.successCount(),
            extraction.units().size(),
            crawl.finalMethod(),
            signal);

    IntelligencePack draft = synthesizer.synthesize(metadata, extraction.units());
    Set<String> knownPages =
        inventory.stream().map(InventoryEntry::url).collect(Collectors.toUnmodifiableSet());
    ValidationReport report = schemaValidator.validate(draft, knownPages);
    IntelligencePack pack = draft.withValidationWarnings(report.warnings());

    Path runDir = artifactWriter.write(domain, inventory, ranked, extraction, pack);

    if (signal.degraded()) {
      // Only batch runs reach the notifier; interactive runs log the signal instead.
      if (params.batch()) {
        notifier.notifyDegraded(domain, signal, runDir);
      } else {
        log.warn(
            "Run for {} is degraded (interactive run, notifier not called): {}",
            domain,
            String.join("; ", signal.reasons()));
      }
    }
    log.info(
        "Finished run for {}: {} claims, {} evidence entries, {} warnings, artifacts in {}",
        domain,
        pack.claimsByDimension().values().stream().mapToInt(List::size).sum(),
        pack.evidenceIndex().size(),
        pack.validationWarnings().size(),
        runDir);
    return new RunResult(runDir, pack, signal);
  }
}
