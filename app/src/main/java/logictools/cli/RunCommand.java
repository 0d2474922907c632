package logictools.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import logictools.core.EnumerationOptions;
import logictools.core.EnumerationResult;
import logictools.core.SizeClassSummary;
import logictools.pipeline.EnumerationPipeline;
import logictools.pipeline.EnumerationRun;
import logictools.pipeline.EnumerationRun.Phase;
import logictools.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary {@code run} command. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  static final int EXIT_BUDGET_EXHAUSTED = 3;

  private final EnumerationPipeline pipeline;

  RunCommand() {
    this(new EnumerationPipeline());
  }

  RunCommand(EnumerationPipeline pipeline) {
    this.pipeline = pipeline;
  }

  int execute(String[] args) throws IOException {
    CliOptions cliOptions = parseRunArgs(args);
    if (cliOptions.help()) {
      LOG.info(Main.USAGE);
      return 0;
    }
    EnumerationOptions options = cliOptions.toEnumerationOptions();
    LOG.info(
        "Strategy {}, {} report to {}",
        options.strategy(),
        cliOptions.format(),
        cliOptions.outputDirectory());

    EnumerationResult result = pipeline.run(options);
    List<Path> written = writeReport(result, cliOptions);

    logSummary(result, written);
    if (result.terminationReason().budgetExhausted()) {
      return EXIT_BUDGET_EXHAUSTED;
    }
    return 0;
  }

  CliOptions parseRunArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          value = CliParsers.nextValue(effectiveArgs, ++i, parsed.option());
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    OptionSpec variables =
        OptionSpec.withValue(
            (b, raw) ->
                b.variableCount(
                    CliParsers.parseInt(raw, EnumerationOptions.DEFAULT_VARIABLE_COUNT, "-n")));
    specs.put("-n", variables);
    specs.put("--n", variables);
    OptionSpec output = OptionSpec.withValue((b, raw) -> b.format(ReportFormat.parse(raw)));
    specs.put("-output", output);
    specs.put("--output", output);
    specs.put(
        "--max-operators",
        OptionSpec.withValue(
            (b, raw) -> b.maxOperatorCount(CliParsers.parseInt(raw, -1, "--max-operators"))));
    specs.put(
        "--max-formulas",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxFormulas(
                    CliParsers.parseLong(
                        raw, EnumerationOptions.DEFAULT_MAX_FORMULAS, "--max-formulas"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, 0L, "--time-budget-ms"))));
    specs.put(
        "--operators",
        OptionSpec.withValue((b, raw) -> b.operators(CliParsers.parseOperators(raw))));
    specs.put(
        "--strategy", OptionSpec.withValue((b, raw) -> b.strategy(CliParsers.parseStrategy(raw))));
    specs.put("--parallel", OptionSpec.flag(b -> b.parallel(true)));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) ->
                b.parallel(true).parallelism(CliParsers.parseInt(raw, 0, "--parallelism"))));
    specs.put("--stop-when-complete", OptionSpec.flag(b -> b.stopWhenComplete(true)));
    specs.put("--output-dir", OptionSpec.withValue((b, raw) -> b.outputDirectory(Path.of(raw))));
    OptionSpec help = OptionSpec.flag(b -> b.help(true));
    specs.put("-h", help);
    specs.put("--help", help);
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("run".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private List<Path> writeReport(EnumerationResult result, CliOptions options)
      throws IOException {
    EnumerationRun run = result.run();
    List<Path> written;
    try (EnumerationRun.Timer timer = run.startTimer(Phase.REPORTING)) {
      written = options.format().writer().write(result, options.outputDirectory());
    }
    run.recordPhaseMs(Phase.TOTAL, run.totalMs() + run.reportingMs());
    return written;
  }

  private void logSummary(EnumerationResult result, List<Path> written) {
    for (SizeClassSummary summary : result.sizeClasses()) {
      LOG.info(
          "  size {}: formulas={}, new tables={}, tables={}{}",
          summary.operatorCount(),
          summary.formulas(),
          summary.newTables(),
          summary.tablesAfter(),
          summary.partial() ? " (partial)" : "");
    }
    LOG.info(
        "Found {} of {} truth tables from {} formulas",
        result.tablesFound(),
        result.possibleTables(),
        result.formulasGenerated());
    if (result.isComplete()) {
      LOG.info("Every truth table has a minimal formula.");
    } else {
      LOG.warn("Incomplete: {}", result.terminationReason().description());
    }
    LOG.info("Report files: {}", written);
    LOG.info("Elapsed time: {} ms", result.elapsedMillis());
    LOG.info("\n{}\n{}", result.run(), result.run().percentageBreakdown());
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("-")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
