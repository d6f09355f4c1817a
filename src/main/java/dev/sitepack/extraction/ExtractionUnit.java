package dev.sitepack.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Structured extraction result for one page. Evidence IDs are local to the unit; the synthesizer
 * re-keys them globally.
 *
 * <p>A failed extraction still produces a unit: no fields, no evidence, and a failure note.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionUnit(
    String sourceUrl,
    @Nullable String pageTitle,
    int rank,
    String summary,
    Map<String, ExtractedField> entityFields,
    Map<String, String> evidence,
    Instant extractedAt,
    boolean failed,
    @Nullable String failureNote) {

  public ExtractionUnit {
    entityFields = Collections.unmodifiableMap(new TreeMap<>(entityFields));
    evidence = Collections.unmodifiableMap(new TreeMap<>(evidence));
  }

  static ExtractionUnit failure(
      String sourceUrl, @Nullable String pageTitle, int rank, Instant at, String note) {
    return new ExtractionUnit(sourceUrl, pageTitle, rank, "", Map.of(), Map.of(), at, true, note);
  }

  /** True when the page produced at least one dimension value. */
  @JsonIgnore
  public boolean yieldedFields() {
    return !failed && !entityFields.isEmpty();
  }
}
