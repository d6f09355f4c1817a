package dev.sitepack.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.sitepack.extraction.ExtractionOutcome;
import dev.sitepack.inventory.InventoryEntry;
import dev.sitepack.ranking.RankedEntry;
import dev.sitepack.synthesis.IntelligencePack;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a run's artifacts into a fresh {@code <root>/<domain>/<timestamp>/} directory. Existing
 * run directories are never touched. Each file is written to a temporary sibling and moved into
 * place, and the intelligence pack goes last, so a directory holding the pack is complete.
 */
@Component
public class ArtifactWriter {

  private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

  static final String INVENTORY = "inventory.json";
  static final String RANKED_PAGES = "ranked_pages.json";
  static final String DEEP_EXTRACT = "deep_extract.json";
  static final String PACK = "site_intelligence_pack.json";
  static final String README = "README.md";

  private static final DateTimeFormatter RUN_DIR_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  private final ObjectWriter jsonWriter;
  private final OutputProperties properties;
  private final Clock clock;

  public ArtifactWriter(ObjectMapper objectMapper, OutputProperties properties, Clock clock) {
    this.jsonWriter = objectMapper.writerWithDefaultPrettyPrinter();
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Write all artifacts of a run.
   *
   * @return the run directory
   * @throws UncheckedIOException if any artifact cannot be written
   */
  public Path write(
      String domain,
      List<InventoryEntry> inventory,
      List<RankedEntry> ranked,
      ExtractionOutcome extraction,
      IntelligencePack pack) {
    try {
      Path runDir = createRunDirectory(domain);
      writeAtomically(runDir.resolve(INVENTORY), toJson(inventory));
      writeAtomically(runDir.resolve(RANKED_PAGES), toJson(ranked));
      writeAtomically(runDir.resolve(DEEP_EXTRACT), toJson(extraction));
      writeAtomically(
          runDir.resolve(README),
          ReadmeRenderer.render(pack, Math.max(properties.readmeClaimsPerDimension(), 1)));
      writeAtomically(runDir.resolve(PACK), toJson(pack));
      log.info("Wrote artifacts for {} to {}", domain, runDir);
      return runDir;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write artifacts for " + domain, e);
    }
  }

  private Path createRunDirectory(String domain) throws IOException {
    Path domainDir = properties.rootDir().resolve(domain);
    Files.createDirectories(domainDir);
    String stamp = RUN_DIR_FORMAT.format(clock.instant());
    Path candidate = domainDir.resolve(stamp);
    for (int attempt = 1; ; attempt++) {
      try {
        return Files.createDirectory(candidate);
      } catch (FileAlreadyExistsException e) {
        candidate = domainDir.resolve(stamp + "-" + attempt);
      }
    }
  }

  private String toJson(Object value) throws JsonProcessingException {
    return jsonWriter.writeValueAsString(value);
  }

  private static void writeAtomically(Path target, String content) throws IOException {
    Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
    try {
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
