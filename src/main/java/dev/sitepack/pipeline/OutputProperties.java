package dev.sitepack.pipeline;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param rootDir directory under which {@code <domain>/<timestamp>/} run directories are created
 * @param readmeClaimsPerDimension claims listed per dimension in the generated README
 */
@ConfigurationProperties(prefix = "sitepack.output")
public record OutputProperties(Path rootDir, int readmeClaimsPerDimension) {}
