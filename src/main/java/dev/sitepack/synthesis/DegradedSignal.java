package dev.sitepack.synthesis;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Whether a run fell under the page floor, and why. */
public record DegradedSignal(boolean degraded, List<String> reasons) {

  public DegradedSignal {
    reasons = List.copyOf(reasons);
  }

  public static DegradedSignal healthy() {
    return new DegradedSignal(false, List.of());
  }

  /** Combine stage-level flags; a stage that is not degraded contributes no reason. */
  public static DegradedSignal of(@Nullable String crawlReason, @Nullable String extractionReason) {
    List<String> reasons = new ArrayList<>();
    if (crawlReason != null) {
      reasons.add(crawlReason);
    }
    if (extractionReason != null) {
      reasons.add(extractionReason);
    }
    return new DegradedSignal(!reasons.isEmpty(), reasons);
  }
}
