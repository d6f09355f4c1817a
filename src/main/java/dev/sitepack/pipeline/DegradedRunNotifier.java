package dev.sitepack.pipeline;

import dev.sitepack.synthesis.DegradedSignal;
import java.nio.file.Path;

/**
 * Receives the degraded-run signal, e.g. to open a ticket for a human to look at the run. Called
 * for batch runs only; interactive runs log the signal instead.
 */
public interface DegradedRunNotifier {

  void notifyDegraded(String domain, DegradedSignal signal, Path artifactDirectory);
}
