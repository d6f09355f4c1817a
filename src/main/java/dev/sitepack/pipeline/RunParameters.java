package dev.sitepack.pipeline;

/**
 * Parameters for one run, already validated by whoever dispatched it.
 *
 * @param batch true for scheduled batch runs; degraded signals are only dispatched to the
 *     notifier for those
 */
public record RunParameters(String domain, int pageBudget, int deepExtractCount, boolean batch) {

  public static final int DEFAULT_PAGE_BUDGET = 200;
  public static final int DEFAULT_DEEP_EXTRACT_COUNT = 15;

  public static RunParameters withDefaults(String domain) {
    return new RunParameters(domain, DEFAULT_PAGE_BUDGET, DEFAULT_DEEP_EXTRACT_COUNT, false);
  }
}
