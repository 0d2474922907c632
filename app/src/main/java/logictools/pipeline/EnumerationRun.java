package logictools.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import logictools.core.SizeClassSummary;

/**
 * Tracks timing and per-size-class counts for a single enumeration run.
 *
 * <p>Phase timings accumulate across size classes; {@link Phase#TOTAL} is recorded once at the
 * end.
 */
public final class EnumerationRun {

  public enum Phase {
    GENERATION,
    EVALUATION,
    INGESTION,
    REPORTING,
    TOTAL
  }

  private final long[] phaseMs = new long[Phase.values().length];
  private final List<SizeClassSummary> sizeClasses = new ArrayList<>();
  private final List<String> events = new ArrayList<>();

  public EnumerationRun() {}

  // ----- Recording -----

  public void addPhaseMs(Phase phase, long ms) {
    phaseMs[phase.ordinal()] += ms;
  }

  public void recordPhaseMs(Phase phase, long ms) {
    phaseMs[phase.ordinal()] = ms;
  }

  public void recordSizeClass(SizeClassSummary summary) {
    sizeClasses.add(Objects.requireNonNull(summary, "summary"));
  }

  public void logEvent(String message) {
    if (message == null || message.isBlank()) {
      return;
    }
    events.add(message);
  }

  // ----- Accessors -----

  public List<SizeClassSummary> sizeClasses() {
    return List.copyOf(sizeClasses);
  }

  public List<String> events() {
    return List.copyOf(events);
  }

  public long phaseMs(Phase phase) {
    return phaseMs[phase.ordinal()];
  }

  public long generationMs() {
    return phaseMs(Phase.GENERATION);
  }

  public long evaluationMs() {
    return phaseMs(Phase.EVALUATION);
  }

  public long ingestionMs() {
    return phaseMs(Phase.INGESTION);
  }

  public long reportingMs() {
    return phaseMs(Phase.REPORTING);
  }

  public long totalMs() {
    return phaseMs(Phase.TOTAL);
  }

  public long formulasProcessed() {
    return sizeClasses.stream().mapToLong(SizeClassSummary::formulas).sum();
  }

  /** Time not attributed to a specific phase. */
  public long overheadMs() {
    long sum = generationMs() + evaluationMs() + ingestionMs() + reportingMs();
    return Math.max(0, totalMs() - sum);
  }

  public String percentageBreakdown() {
    if (totalMs() == 0) {
      return "No timing data";
    }
    return String.format(
        Locale.ROOT,
        """
            Phase breakdown (%%):
              Generation: %.1f%%
              Evaluation: %.1f%%
              Ingestion:  %.1f%%
              Reporting:  %.1f%%
              Overhead:   %.1f%%""",
        100.0 * generationMs() / totalMs(),
        100.0 * evaluationMs() / totalMs(),
        100.0 * ingestionMs() / totalMs(),
        100.0 * reportingMs() / totalMs(),
        100.0 * overheadMs() / totalMs());
  }

  @Override
  public String toString() {
    return String.format(
        """
            === Run Metrics ===
            Generation: %d ms (%d size classes)
            Evaluation: %d ms (%d formulas)
            Ingestion:  %d ms
            Reporting:  %d ms
            Overhead:   %d ms
            ------------------
            TOTAL:      %d ms""",
        generationMs(),
        sizeClasses.size(),
        evaluationMs(),
        formulasProcessed(),
        ingestionMs(),
        reportingMs(),
        overheadMs(),
        totalMs());
  }

  // ----- Timer -----

  public Timer startTimer(Phase phase) {
    return new Timer(this, phase);
  }

  /** Adds the elapsed time of a block to a phase when closed. */
  public static final class Timer implements AutoCloseable {
    private final EnumerationRun run;
    private final Phase phase;
    private final long startNs;

    private Timer(EnumerationRun run, Phase phase) {
      this.run = run;
      this.phase = phase;
      this.startNs = System.nanoTime();
    }

    public long elapsedMillis() {
      return (System.nanoTime() - startNs) / 1_000_000;
    }

    @Override
    public void close() {
      run.addPhaseMs(phase, elapsedMillis());
    }
  }
}
