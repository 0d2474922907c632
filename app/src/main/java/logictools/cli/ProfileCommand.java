package logictools.cli;

import java.util.Locale;
import logictools.core.EnumerationOptions;
import logictools.profile.TractabilityProfiler;
import logictools.profile.TractabilityProfiler.ProfileRun;
import logictools.profile.TractabilityProfiler.TractabilityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the {@code profile} command. */
final class ProfileCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProfileCommand.class);

  private final TractabilityProfiler profiler;

  ProfileCommand() {
    this(new TractabilityProfiler());
  }

  ProfileCommand(TractabilityProfiler profiler) {
    this.profiler = profiler;
  }

  int execute(String[] args) {
    ProfileOptions options = parseProfileArgs(args);
    TractabilityProfile report =
        profiler.profile(
            options.maxVariableCount(), options.maxOperatorCount(), options.maxFormulas());
    logProfileReport(report, options);
    return 0;
  }

  ProfileOptions parseProfileArgs(String[] args) {
    if (args.length == 0 || !"profile".equalsIgnoreCase(args[0])) {
      throw new IllegalArgumentException("Unknown command: " + (args.length == 0 ? "" : args[0]));
    }

    String maxNRaw = null;
    String maxOperatorsRaw = null;
    String maxFormulasRaw = null;

    for (int i = 1; i < args.length; i++) {
      String rawArg = args[i];
      String option = rawArg;
      String inlineValue = null;
      if (rawArg.startsWith("--")) {
        int equalsIndex = rawArg.indexOf('=');
        if (equalsIndex > 0) {
          option = rawArg.substring(0, equalsIndex);
          inlineValue = rawArg.substring(equalsIndex + 1);
          if (inlineValue.isEmpty()) {
            inlineValue = null;
          }
        }
      }

      switch (option) {
        case "--max-n" ->
            maxNRaw = inlineValue != null ? inlineValue : CliParsers.nextValue(args, ++i, option);
        case "--max-operators" ->
            maxOperatorsRaw =
                inlineValue != null ? inlineValue : CliParsers.nextValue(args, ++i, option);
        case "--max-formulas" ->
            maxFormulasRaw =
                inlineValue != null ? inlineValue : CliParsers.nextValue(args, ++i, option);
        default -> throw new IllegalArgumentException("Unknown option: " + rawArg);
      }
    }

    return new ProfileOptions(
        CliParsers.parseInt(maxNRaw, ProfileOptions.DEFAULT_MAX_VARIABLE_COUNT, "--max-n"),
        CliParsers.parseInt(maxOperatorsRaw, -1, "--max-operators"),
        CliParsers.parseLong(
            maxFormulasRaw, EnumerationOptions.DEFAULT_MAX_FORMULAS, "--max-formulas"));
  }

  private void logProfileReport(TractabilityProfile report, ProfileOptions options) {
    LOG.info(
        "Profiled n=1..{} with maxOperators={}, maxFormulas={}",
        options.maxVariableCount(),
        options.maxOperatorCount() < 0 ? "default" : options.maxOperatorCount(),
        options.maxFormulas());
    LOG.info(
        String.format(
            Locale.ROOT,
            "%3s %6s %12s %12s %14s %9s  %-16s %10s",
            "n",
            "max k",
            "formulas",
            "tables",
            "possible",
            "coverage",
            "termination",
            "ms"));
    for (ProfileRun run : report.runs()) {
      LOG.info(
          String.format(
              Locale.ROOT,
              "%3d %6d %12d %12d %14d %8.2f%%  %-16s %10d",
              run.variableCount(),
              run.maxOperatorCount(),
              run.formulas(),
              run.tablesFound(),
              run.possibleTables(),
              run.coveragePercent(),
              run.terminationReason().label(),
              run.elapsedMillis()));
    }
    LOG.info(
        "Largest n with every table found: {}; total elapsed millis: {}",
        report.largestCompleteVariableCount(),
        report.totalElapsedMillis());
  }
}
