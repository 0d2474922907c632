package logictools.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import logictools.core.SizeClassSummary;
import logictools.pipeline.EnumerationRun.Phase;
import org.junit.jupiter.api.Test;

final class EnumerationRunTest {

  @Test
  void phasesAccumulateAndOverheadIsRemainder() {
    EnumerationRun run = new EnumerationRun();
    run.addPhaseMs(Phase.GENERATION, 10);
    run.addPhaseMs(Phase.GENERATION, 5);
    run.addPhaseMs(Phase.EVALUATION, 20);
    run.recordPhaseMs(Phase.TOTAL, 50);

    assertEquals(15, run.generationMs(), "Generation accumulates");
    assertEquals(15, run.overheadMs(), "50 - 15 - 20");
    assertTrue(run.percentageBreakdown().contains("Generation: 30.0%"), "Percentages rendered");
  }

  @Test
  void sizeClassesFeedFormulaCount() {
    EnumerationRun run = new EnumerationRun();
    run.recordSizeClass(new SizeClassSummary(0, 4, 4, 4, 0, 0, 0, false));
    run.recordSizeClass(new SizeClassSummary(1, 96, 12, 16, 0, 0, 0, false));
    run.logEvent(" ");

    assertEquals(100, run.formulasProcessed(), "Sum over size classes");
    assertTrue(run.events().isEmpty(), "Blank events are ignored");
    assertEquals("No timing data", run.percentageBreakdown(), "No total recorded yet");
  }

  @Test
  void timerAddsElapsedTimeOnClose() throws InterruptedException {
    EnumerationRun run = new EnumerationRun();
    try (EnumerationRun.Timer timer = run.startTimer(Phase.REPORTING)) {
      Thread.sleep(5);
    }

    assertTrue(run.reportingMs() >= 5, "Sleep time attributed to reporting");
  }
}
