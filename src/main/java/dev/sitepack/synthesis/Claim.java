package dev.sitepack.synthesis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * One page's statement about one dimension.
 *
 * @param evidenceRefs global evidence IDs; citations that could not be re-keyed appear as
 *     {@code unresolved:<local id>}
 * @param broken true when none of the references resolve
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Claim(
    String id,
    String dimension,
    String statement,
    List<String> evidenceRefs,
    String sourceUrl,
    boolean broken) {

  public static final String UNRESOLVED_PREFIX = "unresolved:";

  public Claim {
    evidenceRefs = List.copyOf(evidenceRefs);
  }
}
