package logictools.catalog;

import java.util.List;
import java.util.Objects;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;

/** Read-only snapshot of one catalog entry, as handed to report writers. */
public record TableGroup(
    TruthTable table, int minimalCount, List<Formula> minimalFormulas, List<Formula> allFormulas) {

  public TableGroup {
    Objects.requireNonNull(table, "table");
    minimalFormulas = List.copyOf(Objects.requireNonNull(minimalFormulas, "minimalFormulas"));
    allFormulas = List.copyOf(Objects.requireNonNull(allFormulas, "allFormulas"));
  }

  static TableGroup of(CatalogEntry entry) {
    return new TableGroup(
        entry.table(), entry.minimalCount(), entry.minimalFormulas(), entry.allFormulas());
  }
}
