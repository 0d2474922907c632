package logictools.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import logictools.catalog.MinimalityPolicy.Verdict;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;

/**
 * Truth table → entry mapping built during one enumeration run.
 *
 * <p>Entries are created on first sighting and never removed. Ingestion trusts the generator's
 * no-duplicate contract but refuses a repeated formula instead of silently dropping it. Not
 * thread-safe: the pipeline ingests from a single owner thread and freezes the catalog when
 * generation ends.
 */
public final class Catalog implements CatalogView {
  private final int variableCount;
  private final MinimalityPolicy policy;
  private final Map<TruthTable, CatalogEntry> entries = new LinkedHashMap<>();
  private final List<Formula> ingestionOrder = new ArrayList<>();
  private final CatalogStats stats = new CatalogStats();
  private boolean frozen;

  public Catalog(int variableCount) {
    this(variableCount, MinimalityPolicy.FEWEST_BINARY_OPERATORS);
  }

  public Catalog(int variableCount, MinimalityPolicy policy) {
    if (variableCount < 1 || variableCount > TruthTable.MAX_VARIABLES) {
      throw new IllegalArgumentException("variableCount out of range: " + variableCount);
    }
    this.variableCount = variableCount;
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Records {@code formula} under {@code table}.
   *
   * @throws IllegalStateException if the catalog is frozen or the formula was already ingested
   * @throws IllegalArgumentException if the table width does not match this catalog
   */
  public Verdict ingest(Formula formula, TruthTable table) {
    Objects.requireNonNull(formula, "formula");
    Objects.requireNonNull(table, "table");
    if (frozen) {
      throw new IllegalStateException("Catalog is frozen; cannot ingest " + formula);
    }
    if (table.variableCount() != variableCount) {
      throw new IllegalArgumentException(
          "table has " + table.variableCount() + " variables, catalog has " + variableCount);
    }
    CatalogEntry entry = entries.computeIfAbsent(table, t -> new CatalogEntry(t, entries.size()));
    Verdict verdict = entry.record(formula, policy);
    ingestionOrder.add(formula);
    stats.record(verdict);
    return verdict;
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public Optional<CatalogEntry> entry(TruthTable table) {
    return Optional.ofNullable(entries.get(table));
  }

  public List<CatalogEntry> entries() {
    return List.copyOf(entries.values());
  }

  public CatalogStats stats() {
    return stats.snapshot();
  }

  @Override
  public int variableCount() {
    return variableCount;
  }

  @Override
  public List<Formula> listAllFormulas() {
    return Collections.unmodifiableList(ingestionOrder);
  }

  @Override
  public List<TableGroup> listTruthTables() {
    List<TableGroup> groups = new ArrayList<>(entries.size());
    for (CatalogEntry entry : entries.values()) {
      groups.add(TableGroup.of(entry));
    }
    return groups;
  }

  @Override
  public Optional<TableGroup> group(TruthTable table) {
    return entry(table).map(TableGroup::of);
  }

  @Override
  public int tableCount() {
    return entries.size();
  }

  @Override
  public long formulaCount() {
    return ingestionOrder.size();
  }
}
