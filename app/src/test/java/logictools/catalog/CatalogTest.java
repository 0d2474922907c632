package logictools.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import logictools.catalog.MinimalityPolicy.Verdict;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;
import logictools.eval.TruthTableEvaluator;
import org.junit.jupiter.api.Test;

final class CatalogTest {
  private static final Formula A = Formula.variable(0);
  private static final Formula B = Formula.variable(1);
  private static final TruthTableEvaluator EVALUATOR = new TruthTableEvaluator(2);

  @Test
  void firstSightingBecomesMinimalAndTiesAccumulate() {
    Catalog catalog = new Catalog(2);
    Formula and = Formula.and(A, B);
    Formula andSwapped = Formula.and(B, A);
    Formula andLonger = Formula.and(Formula.and(A, B), A);

    assertEquals(Verdict.FIRST, ingest(catalog, and), "New table");
    assertEquals(Verdict.TIES, ingest(catalog, andSwapped), "Same size, same table");
    assertEquals(Verdict.LOSES, ingest(catalog, andLonger), "Larger formula");

    TableGroup group = catalog.group(EVALUATOR.evaluate(and)).orElseThrow();
    assertEquals(1, group.minimalCount(), "Minimal operator count");
    assertEquals(List.of(and, andSwapped), group.minimalFormulas(), "Ties kept in order");
    assertEquals(List.of(and, andSwapped, andLonger), group.allFormulas(), "Everything kept");
  }

  @Test
  void smallerFormulaDethronesIncumbent() {
    Catalog catalog = new Catalog(2);
    Formula big = Formula.and(Formula.or(A, A), B);
    Formula small = Formula.and(A, B);

    ingest(catalog, big);
    assertEquals(Verdict.DETHRONES, ingest(catalog, small), "Fewer operators wins");

    CatalogEntry entry = catalog.entry(EVALUATOR.evaluate(small)).orElseThrow();
    assertEquals(1, entry.minimalCount(), "Minimum replaced");
    assertEquals(List.of(small), entry.minimalFormulas(), "Old minimal list discarded");
    assertEquals(2, entry.formulaCount(), "Both formulas remain in the full list");
    assertEquals(1, catalog.stats().dethronements(), "Dethronement counted");
  }

  @Test
  void sameTableMapsToSameEntry() {
    Catalog catalog = new Catalog(2);
    Formula xor = Formula.xor(A, B);
    Formula xorByHand = Formula.or(Formula.and(A, Formula.not(B)), Formula.and(Formula.not(A), B));

    ingest(catalog, xor);
    ingest(catalog, xorByHand);

    assertEquals(1, catalog.tableCount(), "Equivalent formulas share one entry");
    assertEquals(List.of(xor), catalog.listTruthTables().get(0).minimalFormulas(), "XOR wins");
  }

  @Test
  void tablesAreListedInDiscoveryOrder() {
    Catalog catalog = new Catalog(2);
    ingest(catalog, B);
    ingest(catalog, A);
    ingest(catalog, Formula.not(B));

    List<TableGroup> groups = catalog.listTruthTables();
    assertEquals(EVALUATOR.evaluate(B), groups.get(0).table(), "First discovered first");
    assertEquals(EVALUATOR.evaluate(A), groups.get(1).table(), "Second discovered second");
    assertEquals(2, catalog.entries().get(2).discoveryIndex(), "Discovery index recorded");
    assertEquals(List.of(B, A, Formula.not(B)), catalog.listAllFormulas(), "Ingestion order");
  }

  @Test
  void rejectsDuplicateFrozenAndMismatchedIngestion() {
    Catalog catalog = new Catalog(2);
    ingest(catalog, A);

    assertThrows(IllegalStateException.class, () -> ingest(catalog, A), "Duplicate formula");
    assertThrows(
        IllegalArgumentException.class,
        () -> catalog.ingest(B, TruthTable.of(1, 0b01)),
        "Width mismatch");
    catalog.freeze();
    assertTrue(catalog.isFrozen(), "Frozen");
    assertThrows(IllegalStateException.class, () -> ingest(catalog, B), "Frozen catalog");
  }

  @Test
  void statsAreSnapshots() {
    Catalog catalog = new Catalog(2);
    CatalogStats before = catalog.stats();
    ingest(catalog, A);

    assertEquals(0, before.ingested(), "Earlier snapshot unchanged");
    assertEquals(1, catalog.stats().firstSightings(), "New snapshot sees the ingestion");
  }

  @Test
  void completenessComparesAgainstAllPossibleTables() {
    Catalog catalog = new Catalog(1);
    Formula p = Formula.variable(0);
    TruthTableEvaluator evaluator = new TruthTableEvaluator(1);
    for (Formula formula :
        List.of(
            p, Formula.not(p), Formula.and(p, Formula.not(p)), Formula.or(p, Formula.not(p)))) {
      assertFalse(catalog.isComplete(), "Not complete before the last table");
      catalog.ingest(formula, evaluator.evaluate(formula));
    }
    assertTrue(catalog.isComplete(), "All four one-variable tables found");
    assertEquals(4, catalog.possibleTableCount(), "2^(2^1)");
  }

  private static Verdict ingest(Catalog catalog, Formula formula) {
    return catalog.ingest(formula, EVALUATOR.evaluate(formula));
  }
}
