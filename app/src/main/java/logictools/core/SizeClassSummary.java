package logictools.core;

/**
 * Outcome of one size class: how many formulas went through the catalog and how many tables they
 * added. {@code partial} is set when a time budget cut ingestion short.
 */
public record SizeClassSummary(
    int operatorCount,
    long formulas,
    int newTables,
    int tablesAfter,
    long generationMs,
    long evaluationMs,
    long ingestionMs,
    boolean partial) {

  public SizeClassSummary {
    if (operatorCount < 0) {
      throw new IllegalArgumentException("operatorCount must be >= 0");
    }
    if (formulas < 0 || newTables < 0) {
      throw new IllegalArgumentException("counts must be non-negative");
    }
  }
}
