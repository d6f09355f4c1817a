package dev.sitepack.extraction;

import java.util.List;

/**
 * One dimension's value as stated on a page, with the unit-local evidence IDs it cites.
 */
public record ExtractedField(String value, List<String> evidence) {
  public ExtractedField {
    evidence = List.copyOf(evidence);
  }
}
