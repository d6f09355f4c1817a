package dev.sitepack.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import dev.sitepack.llm.ExtractionProperties;
import dev.sitepack.llm.ExtractionService;
import dev.sitepack.ranking.RankedEntry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs structured extraction over the top-K ranked pages.
 *
 * <p>With K of 3 or more the pages go to a fixed worker pool of {@code min(K, max-workers)}
 * threads; below that they run one after another. Both paths execute the same per-page task, so
 * the units are identical either way. Every call runs under its own timeout. A failure or
 * timeout yields a placeholder unit and leaves the other pages alone. Units come back in rank
 * order.
 */
@Service
public class DeepExtractionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(DeepExtractionCoordinator.class);

  static final int PARALLEL_THRESHOLD = 3;
  static final int MIN_YIELDED_UNITS = 5;

  private final ExtractionService extractionService;
  private final Clock clock;
  private final Duration taskTimeout;
  private final int maxWorkers;
  private final int maxContentChars;
  private final ExecutorService callExecutor;
  private final TimeLimiter timeLimiter;

  public DeepExtractionCoordinator(
      ExtractionService extractionService, ExtractionProperties properties, Clock clock) {
    this.extractionService = extractionService;
    this.clock = clock;
    this.taskTimeout = properties.taskTimeout();
    this.maxWorkers = properties.maxWorkers();
    this.maxContentChars = properties.maxContentChars();
    this.callExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("extract-call-%d").setDaemon(true).build());
    this.timeLimiter = SimpleTimeLimiter.create(callExecutor);
  }

  /**
   * Extract the top {@code k} pages.
   *
   * @param ranked ranked representative pages
   * @param k number of pages to extract; fewer are used if fewer are ranked
   */
  public ExtractionOutcome extract(List<RankedEntry> ranked, int k) {
    List<RankedEntry> selected =
        ranked.stream()
            .sorted(Comparator.comparingInt(RankedEntry::rank))
            .limit(Math.max(k, 0))
            .toList();

    List<ExtractionUnit> units =
        selected.size() >= PARALLEL_THRESHOLD ? runPooled(selected) : runSequential(selected);

    int yielded = (int) units.stream().filter(ExtractionUnit::yieldedFields).count();
    boolean degraded = yielded < MIN_YIELDED_UNITS;
    String reason =
        degraded
            ? "Only " + yielded + " of " + selected.size() + " extracted pages yielded fields"
                + " (minimum " + MIN_YIELDED_UNITS + ")"
            : null;
    log.info(
        "Deep extraction finished: {} pages, {} yielded fields, {} failed",
        units.size(),
        yielded,
        units.stream().filter(ExtractionUnit::failed).count());
    if (degraded) {
      log.warn(reason);
    }
    return new ExtractionOutcome(units, yielded, degraded, reason);
  }

  private List<ExtractionUnit> runSequential(List<RankedEntry> selected) {
    List<ExtractionUnit> units = new ArrayList<>(selected.size());
    for (RankedEntry page : selected) {
      units.add(extractPage(page));
    }
    return units;
  }

  private List<ExtractionUnit> runPooled(List<RankedEntry> selected) {
    int poolSize = Math.min(selected.size(), maxWorkers);
    ExecutorService workers =
        Executors.newFixedThreadPool(
            poolSize,
            new ThreadFactoryBuilder().setNameFormat("deep-extract-%d").setDaemon(true).build());
    log.debug("Extracting {} pages on {} workers", selected.size(), poolSize);
    try {
      List<Future<ExtractionUnit>> futures = new ArrayList<>(selected.size());
      for (RankedEntry page : selected) {
        futures.add(workers.submit(() -> extractPage(page)));
      }
      List<ExtractionUnit> units = new ArrayList<>(selected.size());
      for (int i = 0; i < futures.size(); i++) {
        units.add(await(futures.get(i), selected.get(i)));
      }
      return units;
    } finally {
      workers.shutdownNow();
    }
  }

  private ExtractionUnit await(Future<ExtractionUnit> future, RankedEntry page) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return placeholder(page, "interrupted while waiting for extraction");
    } catch (ExecutionException e) {
      return placeholder(page, "extraction task failed: " + e.getCause());
    }
  }

  /** The per-page task. Never throws. */
  ExtractionUnit extractPage(RankedEntry page) {
    String content = pageContent(page);
    try {
      ObjectNode reply =
          timeLimiter.callWithTimeout(
              () -> extractionService.extract(ExtractionPrompts.DEEP_EXTRACT, content),
              taskTimeout.toMillis(),
              TimeUnit.MILLISECONDS);
      return ExtractionUnitParser.parse(page, reply, clock.instant());
    } catch (TimeoutException e) {
      log.warn("Extraction of {} timed out after {}", page.entry().url(), taskTimeout);
      return placeholder(page, "timed out after " + taskTimeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return placeholder(page, "interrupted");
    } catch (ExecutionException e) {
      log.warn("Extraction of {} failed: {}", page.entry().url(), e.getCause().getMessage());
      return placeholder(page, String.valueOf(e.getCause().getMessage()));
    } catch (RuntimeException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("Extraction of {} failed: {}", page.entry().url(), cause.getMessage());
      return placeholder(page, String.valueOf(cause.getMessage()));
    }
  }

  private ExtractionUnit placeholder(RankedEntry page, String note) {
    return ExtractionUnit.failure(
        page.entry().url(), page.entry().title(), page.rank(), clock.instant(), note);
  }

  private String pageContent(RankedEntry page) {
    StringBuilder sb = new StringBuilder();
    sb.append("URL: ").append(page.entry().url()).append('\n');
    if (page.entry().title() != null) {
      sb.append("Title: ").append(page.entry().title()).append('\n');
    }
    sb.append("\nContent:\n");
    if (page.entry().content() != null) {
      sb.append(page.entry().content());
    }
    return sb.length() > maxContentChars ? sb.substring(0, maxContentChars) : sb.toString();
  }

  @PreDestroy
  void shutdown() {
    callExecutor.shutdownNow();
  }
}
