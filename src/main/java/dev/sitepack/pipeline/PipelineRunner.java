package dev.sitepack.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts a single run at application startup when {@code sitepack.run.domain} is set, e.g.
 * {@code --sitepack.run.domain=example.com --sitepack.run.batch=true}.
 */
@Component
@ConditionalOnProperty(prefix = "sitepack.run", name = "domain")
public class PipelineRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

  private final SiteIntelligencePipeline pipeline;
  private final RunParameters params;

  public PipelineRunner(
      SiteIntelligencePipeline pipeline,
      @Value("${sitepack.run.domain}") String domain,
      @Value("${sitepack.run.page-budget:" + RunParameters.DEFAULT_PAGE_BUDGET + "}") int pageBudget,
      @Value("${sitepack.run.deep-extract-count:" + RunParameters.DEFAULT_DEEP_EXTRACT_COUNT + "}")
          int deepExtractCount,
      @Value("${sitepack.run.batch:false}") boolean batch) {
    this.pipeline = pipeline;
    this.params = new RunParameters(domain, pageBudget, deepExtractCount, batch);
  }

  @Override
  public void run(ApplicationArguments args) {
    RunResult result = pipeline.run(params);
    log.info(
        "Site intelligence pack for {} written to {} (degraded={})",
        params.domain(),
        result.artifactDirectory(),
        result.degraded().degraded());
  }
}
