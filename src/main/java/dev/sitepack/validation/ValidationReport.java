package dev.sitepack.validation;

import java.util.List;

/** Outcome of validating a pack. {@code valid} holds only when there are no warnings. */
public record ValidationReport(boolean valid, List<String> warnings) {
  public ValidationReport {
    warnings = List.copyOf(warnings);
  }

  public static ValidationReport of(List<String> warnings) {
    return new ValidationReport(warnings.isEmpty(), warnings);
  }
}
