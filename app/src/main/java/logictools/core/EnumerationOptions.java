package logictools.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import logictools.core.model.Operator;
import logictools.core.model.TruthTable;
import logictools.eval.EvaluationStrategy;

/** Configuration for one enumeration run. */
public record EnumerationOptions(
    int variableCount,
    int maxOperatorCount,
    long maxFormulas,
    long timeBudgetMs,
    Set<Operator> operators,
    EvaluationStrategy strategy,
    boolean parallel,
    int parallelism,
    boolean stopWhenComplete) {

  public static final int DEFAULT_VARIABLE_COUNT = 3;
  public static final long DEFAULT_MAX_FORMULAS = 5_000_000L;

  // Indexed by n; beyond these ceilings a size class no longer fits a default heap.
  private static final int[] DEFAULT_MAX_OPERATORS = {0, 2, 3, 3, 2, 2};

  public EnumerationOptions {
    if (variableCount < 1 || variableCount > TruthTable.MAX_VARIABLES) {
      throw new IllegalArgumentException(
          "n must be between 1 and " + TruthTable.MAX_VARIABLES + ": " + variableCount);
    }
    if (maxOperatorCount < 0) {
      throw new IllegalArgumentException("max operator count must be non-negative");
    }
    if (maxFormulas < 1) {
      throw new IllegalArgumentException("formula budget must be positive");
    }
    if (timeBudgetMs < 0) {
      throw new IllegalArgumentException("time budget must be non-negative");
    }
    Objects.requireNonNull(operators, "operators");
    if (operators.isEmpty()) {
      throw new IllegalArgumentException("at least one binary operator is required");
    }
    operators = Collections.unmodifiableSet(EnumSet.copyOf(operators));
    strategy = strategy == null ? EvaluationStrategy.BITWISE : strategy;
    parallelism = parallelism < 1 ? Runtime.getRuntime().availableProcessors() : parallelism;
  }

  public static EnumerationOptions defaults() {
    return defaults(DEFAULT_VARIABLE_COUNT);
  }

  public static EnumerationOptions defaults(int variableCount) {
    return builder(variableCount).build();
  }

  public static int defaultMaxOperatorCount(int variableCount) {
    if (variableCount < 1 || variableCount >= DEFAULT_MAX_OPERATORS.length) {
      throw new IllegalArgumentException("no default ceiling for n=" + variableCount);
    }
    return DEFAULT_MAX_OPERATORS[variableCount];
  }

  public static Builder builder(int variableCount) {
    return new Builder(variableCount);
  }

  public Builder toBuilder() {
    return new Builder(variableCount)
        .maxOperatorCount(maxOperatorCount)
        .maxFormulas(maxFormulas)
        .timeBudgetMs(timeBudgetMs)
        .operators(operators)
        .strategy(strategy)
        .parallel(parallel)
        .parallelism(parallelism)
        .stopWhenComplete(stopWhenComplete);
  }

  public boolean hasTimeBudget() {
    return timeBudgetMs > 0;
  }

  /** Fluent builder; unset fields take the per-{@code n} defaults. */
  public static final class Builder {
    private final int variableCount;
    private int maxOperatorCount = -1;
    private long maxFormulas = DEFAULT_MAX_FORMULAS;
    private long timeBudgetMs;
    private Set<Operator> operators = EnumSet.allOf(Operator.class);
    private EvaluationStrategy strategy = EvaluationStrategy.BITWISE;
    private boolean parallel;
    private int parallelism;
    private boolean stopWhenComplete;

    private Builder(int variableCount) {
      this.variableCount = variableCount;
    }

    public Builder maxOperatorCount(int maxOperatorCount) {
      this.maxOperatorCount = maxOperatorCount;
      return this;
    }

    public Builder maxFormulas(long maxFormulas) {
      this.maxFormulas = maxFormulas;
      return this;
    }

    public Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    public Builder operators(Set<Operator> operators) {
      this.operators = operators;
      return this;
    }

    public Builder strategy(EvaluationStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public Builder stopWhenComplete(boolean stopWhenComplete) {
      this.stopWhenComplete = stopWhenComplete;
      return this;
    }

    public EnumerationOptions build() {
      int ceiling =
          maxOperatorCount >= 0 ? maxOperatorCount : defaultMaxOperatorCount(variableCount);
      return new EnumerationOptions(
          variableCount,
          ceiling,
          maxFormulas,
          timeBudgetMs,
          operators,
          strategy,
          parallel,
          parallelism,
          stopWhenComplete);
    }
  }
}
