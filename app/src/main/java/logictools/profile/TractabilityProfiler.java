package logictools.profile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import logictools.core.EnumerationOptions;
import logictools.core.EnumerationResult;
import logictools.core.TerminationReason;
import logictools.core.model.TruthTable;
import logictools.pipeline.EnumerationPipeline;

/** Runs the enumeration for n = 1..N to show where exhaustive search stops being tractable. */
public final class TractabilityProfiler {

  /** Per-n profiling outcome. */
  public record ProfileRun(
      int variableCount,
      int maxOperatorCount,
      long formulas,
      int tablesFound,
      long possibleTables,
      TerminationReason terminationReason,
      long elapsedMillis) {

    public ProfileRun {
      Objects.requireNonNull(terminationReason, "terminationReason");
    }

    public double coveragePercent() {
      return 100.0 * tablesFound / possibleTables;
    }

    static ProfileRun of(EnumerationResult result) {
      return new ProfileRun(
          result.options().variableCount(),
          result.options().maxOperatorCount(),
          result.formulasGenerated(),
          result.tablesFound(),
          result.possibleTables(),
          result.terminationReason(),
          result.elapsedMillis());
    }
  }

  /** Aggregated profiling report. */
  public record TractabilityProfile(List<ProfileRun> runs) {
    public TractabilityProfile {
      runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public long totalElapsedMillis() {
      return runs.stream().mapToLong(ProfileRun::elapsedMillis).sum();
    }

    /** Largest n whose run found every truth table, or 0 if none did. */
    public int largestCompleteVariableCount() {
      int largest = 0;
      for (ProfileRun run : runs) {
        if (run.terminationReason() == TerminationReason.COMPLETE) {
          largest = Math.max(largest, run.variableCount());
        }
      }
      return largest;
    }
  }

  private final EnumerationPipeline pipeline;

  public TractabilityProfiler() {
    this(new EnumerationPipeline());
  }

  public TractabilityProfiler(EnumerationPipeline pipeline) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  /**
   * Profiles every n from 1 to {@code maxVariableCount}.
   *
   * @param maxOperatorCount ceiling applied to every n, or a negative value for the per-n default
   */
  public TractabilityProfile profile(int maxVariableCount, int maxOperatorCount, long maxFormulas) {
    if (maxVariableCount < 1 || maxVariableCount > TruthTable.MAX_VARIABLES) {
      throw new IllegalArgumentException(
          "max n must be between 1 and " + TruthTable.MAX_VARIABLES + ": " + maxVariableCount);
    }
    List<ProfileRun> runs = new ArrayList<>(maxVariableCount);
    for (int n = 1; n <= maxVariableCount; n++) {
      EnumerationOptions options =
          EnumerationOptions.builder(n)
              .maxOperatorCount(maxOperatorCount)
              .maxFormulas(maxFormulas)
              .build();
      runs.add(ProfileRun.of(pipeline.run(options)));
    }
    return new TractabilityProfile(runs);
  }
}
