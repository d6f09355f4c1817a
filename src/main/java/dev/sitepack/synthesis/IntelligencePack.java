package dev.sitepack.synthesis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The final artifact of a run. Claims are grouped by dimension in report order; the evidence
 * index is keyed by global evidence ID in assignment order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IntelligencePack(
    SiteMetadata siteMetadata,
    Map<String, List<Claim>> claimsByDimension,
    Map<String, EvidenceRecord> evidenceIndex,
    List<String> unknownsAndGaps,
    List<String> validationWarnings) {

  public IntelligencePack {
    Map<String, List<Claim>> claims = new LinkedHashMap<>();
    claimsByDimension.forEach((dimension, list) -> claims.put(dimension, List.copyOf(list)));
    claimsByDimension = Collections.unmodifiableMap(claims);
    evidenceIndex = Collections.unmodifiableMap(new LinkedHashMap<>(evidenceIndex));
    unknownsAndGaps = List.copyOf(unknownsAndGaps);
    validationWarnings = List.copyOf(validationWarnings);
  }

  public IntelligencePack withValidationWarnings(List<String> warnings) {
    return new IntelligencePack(
        siteMetadata, claimsByDimension, evidenceIndex, unknownsAndGaps, warnings);
  }
}
