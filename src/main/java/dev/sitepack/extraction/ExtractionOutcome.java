package dev.sitepack.extraction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Units in rank order, plus the degraded flag for the extraction stage. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionOutcome(
    List<ExtractionUnit> units, int yieldedCount, boolean degraded, @Nullable String degradedReason) {
  public ExtractionOutcome {
    units = List.copyOf(units);
  }
}
