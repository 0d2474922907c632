package logictools.cli;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import logictools.core.EnumerationOptions;
import logictools.core.model.Operator;
import logictools.eval.EvaluationStrategy;
import logictools.report.ReportFiles;
import logictools.report.ReportFormat;

record CliOptions(
    int variableCount,
    ReportFormat format,
    int maxOperatorCount,
    long maxFormulas,
    long timeBudgetMs,
    Set<Operator> operators,
    EvaluationStrategy strategy,
    boolean parallel,
    int parallelism,
    boolean stopWhenComplete,
    Path outputDirectory,
    boolean help) {

  CliOptions {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(operators, "operators");
    operators = Set.copyOf(operators);
    outputDirectory =
        outputDirectory == null ? ReportFiles.defaultOutputDirectory() : outputDirectory;
  }

  EnumerationOptions toEnumerationOptions() {
    return EnumerationOptions.builder(variableCount)
        .maxOperatorCount(maxOperatorCount)
        .maxFormulas(maxFormulas)
        .timeBudgetMs(timeBudgetMs)
        .operators(operators)
        .strategy(strategy)
        .parallel(parallel)
        .parallelism(parallelism)
        .stopWhenComplete(stopWhenComplete)
        .build();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private int variableCount = EnumerationOptions.DEFAULT_VARIABLE_COUNT;
    private ReportFormat format = ReportFormat.TEXT;
    private int maxOperatorCount = -1;
    private long maxFormulas = EnumerationOptions.DEFAULT_MAX_FORMULAS;
    private long timeBudgetMs;
    private Set<Operator> operators = EnumSet.allOf(Operator.class);
    private EvaluationStrategy strategy = EvaluationStrategy.BITWISE;
    private boolean parallel;
    private int parallelism;
    private boolean stopWhenComplete;
    private Path outputDirectory;
    private boolean help;

    Builder variableCount(int variableCount) {
      this.variableCount = variableCount;
      return this;
    }

    Builder format(ReportFormat format) {
      this.format = format;
      return this;
    }

    Builder maxOperatorCount(int maxOperatorCount) {
      this.maxOperatorCount = maxOperatorCount;
      return this;
    }

    Builder maxFormulas(long maxFormulas) {
      this.maxFormulas = maxFormulas;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder operators(Set<Operator> operators) {
      this.operators = operators;
      return this;
    }

    Builder strategy(EvaluationStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder stopWhenComplete(boolean stopWhenComplete) {
      this.stopWhenComplete = stopWhenComplete;
      return this;
    }

    Builder outputDirectory(Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    Builder help(boolean help) {
      this.help = help;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          variableCount,
          format,
          maxOperatorCount,
          maxFormulas,
          timeBudgetMs,
          operators,
          strategy,
          parallel,
          parallelism,
          stopWhenComplete,
          outputDirectory,
          help);
    }
  }
}
