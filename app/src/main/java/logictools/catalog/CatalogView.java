package logictools.catalog;

import java.util.List;
import java.util.Optional;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;

/** Read interface consumed by the report writers once generation has finished. */
public interface CatalogView {

  int variableCount();

  /** Every ingested formula in generation order. */
  List<Formula> listAllFormulas();

  /** One group per discovered table, in first-discovery order. */
  List<TableGroup> listTruthTables();

  Optional<TableGroup> group(TruthTable table);

  int tableCount();

  long formulaCount();

  default long possibleTableCount() {
    return TruthTable.possibleTables(variableCount());
  }

  default boolean isComplete() {
    return tableCount() == possibleTableCount();
  }
}
