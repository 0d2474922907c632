package logictools.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import logictools.catalog.TableGroup;
import logictools.core.EnumerationOptions;
import logictools.core.EnumerationResult;
import logictools.core.SizeClassSummary;
import logictools.core.TerminationReason;
import logictools.core.model.Formula;
import logictools.core.model.Operator;
import logictools.core.model.TruthTable;
import logictools.eval.EvaluationStrategy;
import logictools.eval.TruthTableEvaluator;
import logictools.testing.TestDefaults;
import org.junit.jupiter.api.Test;

final class EnumerationPipelineTest {

  @Test
  void oneVariableFindsAllFourTables() {
    EnumerationResult result =
        new EnumerationPipeline().run(EnumerationOptions.builder(1).maxOperatorCount(1).build());

    assertEquals(TerminationReason.COMPLETE, result.terminationReason(), "n=1 completes");
    assertEquals(4, result.tablesFound(), "false, p1, ~p1, true");
    TruthTable alwaysFalse = TruthTable.ofRows(1, 0, 0);
    TableGroup group = result.catalog().group(alwaysFalse).orElseThrow();
    Formula p1 = Formula.variable(0);
    assertEquals(
        Formula.and(p1, Formula.not(p1)),
        group.minimalFormulas().get(0),
        "Constant false is first reached by p1 & ~p1");
  }

  @Test
  void twoVariablesCompleteAtOneOperatorWithXorMinimal() {
    EnumerationResult result =
        new EnumerationPipeline().run(EnumerationOptions.builder(2).maxOperatorCount(1).build());

    assertTrue(result.isComplete(), "All 16 two-variable functions need at most one operator");
    TableGroup xor = result.catalog().group(TruthTable.ofRows(2, 0, 1, 1, 0)).orElseThrow();
    assertEquals(1, xor.minimalCount(), "XOR needs exactly one operator");
    assertTrue(
        xor.minimalFormulas().contains(Formula.xor(Formula.variable(0), Formula.variable(1))),
        "p1 ^ p2 is among the minimal formulas");
  }

  @Test
  void threeVariablesStopAtCeiling() {
    EnumerationOptions options =
        EnumerationOptions.builder(3).maxOperatorCount(TestDefaults.maxOperators()).build();
    EnumerationResult result = new EnumerationPipeline().run(options);

    assertFalse(result.isComplete(), "Majority is not reachable with so few operators");
    assertEquals(TerminationReason.SIZE_CEILING, result.terminationReason(), "Ceiling reached");
    assertTrue(result.coverage() < 1.0, "Coverage below 100%");
    TruthTable majority = TruthTable.ofRows(3, 0, 0, 0, 1, 0, 1, 1, 1);
    assertTrue(result.catalog().group(majority).isEmpty(), "Majority has no entry");
  }

  @Test
  void fiveVariablesAtCeilingOneAreIncomplete() {
    EnumerationResult result =
        new EnumerationPipeline().run(EnumerationOptions.builder(5).maxOperatorCount(1).build());

    assertEquals(610, result.formulasGenerated(), "10 literals plus 600 one-operator formulas");
    assertEquals(TerminationReason.SIZE_CEILING, result.terminationReason(), "Incomplete");
    assertEquals(1, result.highestCompleteSizeClass(), "Both size classes fully ingested");
  }

  @Test
  void formulaBudgetStopsBeforeOversizedClass() {
    EnumerationOptions options =
        EnumerationOptions.builder(3).maxOperatorCount(3).maxFormulas(10_000).build();

    EnumerationResult result = new EnumerationPipeline().run(options);

    assertEquals(TerminationReason.FORMULA_BUDGET, result.terminationReason(), "Budget hit");
    assertTrue(result.terminationReason().budgetExhausted(), "Counts as a budget stop");
    assertEquals(222, result.formulasGenerated(), "Size classes 0 and 1 only");
    assertEquals(2, result.sizeClasses().size(), "Two size classes processed");
  }

  @Test
  void memoryBudgetStopsWithPartialResults() {
    EnumerationPipeline pipeline = new EnumerationPipeline(() -> 1_000L);

    EnumerationResult result =
        pipeline.run(EnumerationOptions.builder(2).maxOperatorCount(2).build());

    assertEquals(TerminationReason.MEMORY_BUDGET, result.terminationReason(), "Heap estimate");
    assertEquals(4, result.tablesFound(), "Literal tables from size class 0 are kept");
    assertEquals(4, result.formulasGenerated(), "p1, ~p1, p2, ~p2");
  }

  @Test
  void stopWhenCompleteSkipsRemainingClasses() {
    EnumerationOptions options =
        EnumerationOptions.builder(2).maxOperatorCount(3).stopWhenComplete(true).build();

    EnumerationResult result = new EnumerationPipeline().run(options);

    assertTrue(result.isComplete(), "Complete");
    assertEquals(2, result.sizeClasses().size(), "Stopped after size class 1");
  }

  @Test
  void parallelEvaluationMatchesSequential() {
    EnumerationOptions sequential =
        EnumerationOptions.builder(3).maxOperatorCount(TestDefaults.maxOperators()).build();
    EnumerationOptions parallel = sequential.toBuilder().parallel(true).parallelism(3).build();

    EnumerationResult expected = new EnumerationPipeline().run(sequential);
    EnumerationResult actual = new EnumerationPipeline().run(parallel);

    assertEquals(
        expected.catalog().listAllFormulas(),
        actual.catalog().listAllFormulas(),
        "Ingestion order is independent of evaluation threads");
    assertEquals(
        expected.catalog().listTruthTables(),
        actual.catalog().listTruthTables(),
        "Same tables, same minimal formulas, same order");
  }

  @Test
  void catalogInvariantsHoldAfterRun() {
    EnumerationOptions options =
        EnumerationOptions.builder(2)
            .maxOperatorCount(2)
            .strategy(EvaluationStrategy.PER_ASSIGNMENT)
            .operators(EnumSet.of(Operator.AND, Operator.OR))
            .build();
    EnumerationResult result = new EnumerationPipeline().run(options);
    TruthTableEvaluator evaluator = new TruthTableEvaluator(2);

    long total = 0;
    for (TableGroup group : result.catalog().listTruthTables()) {
      List<Formula> minimal = group.minimalFormulas();
      assertFalse(minimal.isEmpty(), "Every entry has a minimum");
      for (Formula formula : group.allFormulas()) {
        assertEquals(group.table(), evaluator.evaluate(formula), "Formula filed under its table");
        assertTrue(formula.operatorCount() >= group.minimalCount(), "Nothing beats the minimum");
      }
      for (Formula formula : minimal) {
        assertEquals(group.minimalCount(), formula.operatorCount(), "Minimal list is uniform");
      }
      total += group.allFormulas().size();
    }
    assertEquals(result.formulasGenerated(), total, "Each formula lives in exactly one entry");
  }

  @Test
  void runRecordsPerSizeClassSummaries() {
    EnumerationResult result =
        new EnumerationPipeline().run(EnumerationOptions.builder(2).maxOperatorCount(1).build());

    List<SizeClassSummary> summaries = result.sizeClasses();
    assertEquals(4, summaries.get(0).newTables(), "Literals give four tables");
    assertEquals(12, summaries.get(1).newTables(), "One operator adds the other twelve");
    assertEquals(100, result.run().formulasProcessed(), "4 + 96 formulas");
    assertTrue(result.elapsedMillis() >= 0, "Total time recorded");
    assertTrue(result.run().events().contains("terminated: complete"), "Termination logged");
  }
}
