package logictools.pipeline;

import com.google.common.math.LongMath;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.function.LongSupplier;
import java.util.stream.IntStream;
import logictools.catalog.Catalog;
import logictools.core.EnumerationOptions;
import logictools.core.EnumerationResult;
import logictools.core.SizeClassSummary;
import logictools.core.TerminationReason;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;
import logictools.eval.TruthTableEvaluator;
import logictools.generate.FormulaGenerator;
import logictools.pipeline.EnumerationRun.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives generator → evaluator → catalog one size class at a time.
 *
 * <p>Before a size class is materialized its exact cardinality is checked against the formula
 * budget and an estimate of the free heap, so an intractable configuration stops with a {@link
 * TerminationReason} and partial results instead of exhausting memory. Evaluation of a size class
 * may be spread over a {@link ForkJoinPool}; ingestion stays on the calling thread in generator
 * order and only starts once the whole class has been evaluated.
 */
public final class EnumerationPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerationPipeline.class);

  /** Rough resident cost of one formula: tree node, pool slot, catalog slots. */
  static final long ESTIMATED_BYTES_PER_FORMULA = 96;

  private static final int DEADLINE_CHECK_INTERVAL = 1 << 16;

  private final LongSupplier availableHeap;

  public EnumerationPipeline() {
    this(EnumerationPipeline::availableHeapBytes);
  }

  EnumerationPipeline(LongSupplier availableHeap) {
    this.availableHeap = Objects.requireNonNull(availableHeap, "availableHeap");
  }

  public EnumerationResult run(EnumerationOptions options) {
    Objects.requireNonNull(options, "options");
    int n = options.variableCount();
    LOG.info(
        "Enumerating formulas over {} variable(s), operators {}, up to {} binary operators",
        n,
        options.operators(),
        options.maxOperatorCount());

    EnumerationRun run = new EnumerationRun();
    long startNs = System.nanoTime();
    long deadlineNs = options.hasTimeBudget() ? startNs + options.timeBudgetMs() * 1_000_000L : 0;

    FormulaGenerator generator =
        new FormulaGenerator(n, options.operators(), options.maxOperatorCount());
    TruthTableEvaluator evaluator = new TruthTableEvaluator(n, options.strategy());
    Catalog catalog = new Catalog(n);

    TerminationReason stop = null;
    ForkJoinPool pool = options.parallel() ? pool(options.parallelism()) : null;
    try {
      for (int k = 0; k <= options.maxOperatorCount(); k++) {
        if (options.stopWhenComplete() && catalog.isComplete()) {
          LOG.info(
              "All {} truth tables found; stopping before size class {}", catalog.tableCount(), k);
          break;
        }
        if (pastDeadline(deadlineNs)) {
          stop = TerminationReason.TIME_BUDGET;
          break;
        }
        stop = checkBudgets(generator.plannedSize(k), catalog.formulaCount(), options, k);
        if (stop != null) {
          break;
        }
        SizeClassSummary summary =
            processSizeClass(k, generator, evaluator, catalog, pool, run, deadlineNs);
        run.recordSizeClass(summary);
        LOG.info(
            "Size class {}: {} formulas, {} new truth tables ({} of {} found)",
            k,
            summary.formulas(),
            summary.newTables(),
            summary.tablesAfter(),
            catalog.possibleTableCount());
        if (summary.partial()) {
          stop = TerminationReason.TIME_BUDGET;
          break;
        }
      }
    } finally {
      if (pool != null && pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
    catalog.freeze();

    TerminationReason reason;
    if (catalog.isComplete()) {
      reason = TerminationReason.COMPLETE;
    } else {
      reason = stop != null ? stop : TerminationReason.SIZE_CEILING;
    }
    if (reason == TerminationReason.COMPLETE) {
      LOG.info("Catalog complete: {} truth tables", catalog.tableCount());
    } else {
      LOG.warn(
          "Generation incomplete ({}): {} of {} truth tables found",
          reason.description(),
          catalog.tableCount(),
          catalog.possibleTableCount());
    }
    run.logEvent("terminated: " + reason.label());
    run.recordPhaseMs(Phase.TOTAL, (System.nanoTime() - startNs) / 1_000_000);

    return new EnumerationResult(options, catalog, catalog.stats(), run.sizeClasses(), reason, run);
  }

  private TerminationReason checkBudgets(
      long planned, long alreadyIngested, EnumerationOptions options, int operatorCount) {
    if (LongMath.saturatedAdd(alreadyIngested, planned) > options.maxFormulas()) {
      LOG.warn(
          "Size class {} holds {} formulas; formula budget {} would be exceeded",
          operatorCount,
          planned,
          options.maxFormulas());
      return TerminationReason.FORMULA_BUDGET;
    }
    long needed = LongMath.saturatedMultiply(planned, ESTIMATED_BYTES_PER_FORMULA);
    long available = availableHeap.getAsLong();
    if (needed > available) {
      LOG.warn(
          "Size class {} needs about {} MiB, only {} MiB of heap available",
          operatorCount,
          needed >> 20,
          available >> 20);
      return TerminationReason.MEMORY_BUDGET;
    }
    return null;
  }

  private SizeClassSummary processSizeClass(
      int operatorCount,
      FormulaGenerator generator,
      TruthTableEvaluator evaluator,
      Catalog catalog,
      ForkJoinPool pool,
      EnumerationRun run,
      long deadlineNs) {
    long t0 = System.nanoTime();
    List<Formula> bucket = generator.buildSizeClass(operatorCount);
    long t1 = System.nanoTime();
    long[] tables = evaluate(bucket, evaluator, pool);
    long t2 = System.nanoTime();

    int tablesBefore = catalog.tableCount();
    int n = evaluator.variableCount();
    boolean partial = false;
    long ingested = 0;
    for (int i = 0; i < bucket.size(); i++) {
      if (i % DEADLINE_CHECK_INTERVAL == DEADLINE_CHECK_INTERVAL - 1 && pastDeadline(deadlineNs)) {
        partial = true;
        LOG.warn("Time budget exhausted after {} formulas of size class {}", i, operatorCount);
        break;
      }
      catalog.ingest(bucket.get(i), TruthTable.of(n, tables[i]));
      ingested++;
    }
    long t3 = System.nanoTime();

    long generationMs = (t1 - t0) / 1_000_000;
    long evaluationMs = (t2 - t1) / 1_000_000;
    long ingestionMs = (t3 - t2) / 1_000_000;
    run.addPhaseMs(Phase.GENERATION, generationMs);
    run.addPhaseMs(Phase.EVALUATION, evaluationMs);
    run.addPhaseMs(Phase.INGESTION, ingestionMs);
    return new SizeClassSummary(
        operatorCount,
        ingested,
        catalog.tableCount() - tablesBefore,
        catalog.tableCount(),
        generationMs,
        evaluationMs,
        ingestionMs,
        partial);
  }

  private static long[] evaluate(
      List<Formula> bucket, TruthTableEvaluator evaluator, ForkJoinPool pool) {
    long[] tables = new long[bucket.size()];
    if (pool == null) {
      for (int i = 0; i < tables.length; i++) {
        tables[i] = evaluator.evaluate(bucket.get(i)).bits();
      }
      return tables;
    }
    pool.submit(
            () ->
                IntStream.range(0, tables.length)
                    .parallel()
                    .forEach(i -> tables[i] = evaluator.evaluate(bucket.get(i)).bits()))
        .join();
    return tables;
  }

  private static ForkJoinPool pool(int parallelism) {
    return parallelism == ForkJoinPool.getCommonPoolParallelism()
        ? ForkJoinPool.commonPool()
        : new ForkJoinPool(parallelism);
  }

  private static boolean pastDeadline(long deadlineNs) {
    return deadlineNs != 0 && System.nanoTime() - deadlineNs > 0;
  }

  static long availableHeapBytes() {
    Runtime runtime = Runtime.getRuntime();
    return runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
  }
}
