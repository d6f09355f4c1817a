package dev.sitepack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the site intelligence pipeline.
 *
 * <p>Runs without a web server. When {@code sitepack.run.domain} is set, a single run is executed
 * at startup by {@link dev.sitepack.pipeline.PipelineRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class SitePackApplication {
    public static void main(String[] args) {
        SpringApplication.run(SitePackApplication.class, args);
    }
}
