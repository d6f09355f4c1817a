package dev.sitepack.pipeline;

import dev.sitepack.synthesis.DegradedSignal;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default notifier: writes the signal to the log. */
@Component
public class LoggingDegradedRunNotifier implements DegradedRunNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingDegradedRunNotifier.class);

  @Override
  public void notifyDegraded(String domain, DegradedSignal signal, Path artifactDirectory) {
    log.warn(
        "Degraded run for {} (artifacts in {}): {}",
        domain,
        artifactDirectory,
        String.join("; ", signal.reasons()));
  }
}
