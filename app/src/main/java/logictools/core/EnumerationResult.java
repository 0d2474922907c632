package logictools.core;

import java.util.List;
import java.util.Objects;
import logictools.catalog.CatalogStats;
import logictools.catalog.CatalogView;
import logictools.pipeline.EnumerationRun;

/** Aggregated outcome of an enumeration run, complete or not. */
public record EnumerationResult(
    EnumerationOptions options,
    CatalogView catalog,
    CatalogStats catalogStats,
    List<SizeClassSummary> sizeClasses,
    TerminationReason terminationReason,
    EnumerationRun run) {

  public EnumerationResult {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(catalogStats, "catalogStats");
    Objects.requireNonNull(terminationReason, "terminationReason");
    Objects.requireNonNull(run, "run");
    sizeClasses = List.copyOf(Objects.requireNonNull(sizeClasses, "sizeClasses"));
  }

  public boolean isComplete() {
    return terminationReason == TerminationReason.COMPLETE;
  }

  public int tablesFound() {
    return catalog.tableCount();
  }

  public long possibleTables() {
    return catalog.possibleTableCount();
  }

  public long formulasGenerated() {
    return catalog.formulaCount();
  }

  /** Fraction of the {@code 2^(2^n)} functions that received an entry. */
  public double coverage() {
    return catalog.tableCount() / (double) catalog.possibleTableCount();
  }

  /** Largest operator count whose size class was ingested in full, or -1 if none was. */
  public int highestCompleteSizeClass() {
    int highest = -1;
    for (SizeClassSummary summary : sizeClasses) {
      if (!summary.partial()) {
        highest = Math.max(highest, summary.operatorCount());
      }
    }
    return highest;
  }

  public long elapsedMillis() {
    return run.totalMs();
  }
}
