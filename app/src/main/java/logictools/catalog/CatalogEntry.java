package logictools.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import logictools.catalog.MinimalityPolicy.Verdict;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;

/**
 * Per-table record: every formula seen for the table plus the subset with the fewest binary
 * operators. Mutated only by {@link Catalog#ingest}.
 */
public final class CatalogEntry {
  private static final int NO_MINIMUM = -1;

  private final TruthTable table;
  private final long discoveryIndex;
  private final Set<Formula> allFormulas = new LinkedHashSet<>();
  private final List<Formula> minimalFormulas = new ArrayList<>(1);
  private int minimalCount = NO_MINIMUM;

  CatalogEntry(TruthTable table, long discoveryIndex) {
    this.table = Objects.requireNonNull(table, "table");
    this.discoveryIndex = discoveryIndex;
  }

  public TruthTable table() {
    return table;
  }

  /** Position of this table in first-discovery order, starting at 0. */
  public long discoveryIndex() {
    return discoveryIndex;
  }

  public int minimalCount() {
    return minimalCount;
  }

  public boolean hasMinimum() {
    return minimalCount != NO_MINIMUM;
  }

  public List<Formula> minimalFormulas() {
    return Collections.unmodifiableList(minimalFormulas);
  }

  public List<Formula> allFormulas() {
    return List.copyOf(allFormulas);
  }

  public int formulaCount() {
    return allFormulas.size();
  }

  Verdict record(Formula formula, MinimalityPolicy policy) {
    if (!allFormulas.add(formula)) {
      throw new IllegalStateException("Formula ingested twice for " + table + ": " + formula);
    }
    int count = formula.operatorCount();
    if (!hasMinimum()) {
      minimalCount = count;
      minimalFormulas.add(formula);
      return Verdict.FIRST;
    }
    Verdict verdict = policy.judge(count, minimalCount);
    switch (verdict) {
      case DETHRONES -> {
        minimalFormulas.clear();
        minimalFormulas.add(formula);
        minimalCount = count;
      }
      case TIES -> minimalFormulas.add(formula);
      case LOSES -> {}
      case FIRST -> throw new IllegalStateException("policy returned FIRST for " + table);
    }
    return verdict;
  }
}
