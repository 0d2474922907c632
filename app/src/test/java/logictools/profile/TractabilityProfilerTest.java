package logictools.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import logictools.core.EnumerationOptions;
import logictools.core.TerminationReason;
import logictools.profile.TractabilityProfiler.ProfileRun;
import logictools.profile.TractabilityProfiler.TractabilityProfile;
import org.junit.jupiter.api.Test;

final class TractabilityProfilerTest {

  @Test
  void profilesEveryVariableCountUpToMax() {
    TractabilityProfile profile =
        new TractabilityProfiler().profile(3, 1, EnumerationOptions.DEFAULT_MAX_FORMULAS);

    assertEquals(3, profile.runs().size(), "One run per n");
    for (int i = 0; i < 3; i++) {
      assertEquals(i + 1, profile.runs().get(i).variableCount(), "Runs ordered by n");
    }
    ProfileRun three = profile.runs().get(2);
    assertEquals(TerminationReason.SIZE_CEILING, three.terminationReason(), "n=3 incomplete");
    assertTrue(three.coveragePercent() < 100.0, "Partial coverage");
    assertEquals(2, profile.largestCompleteVariableCount(), "n=1 and n=2 complete at one op");
    assertTrue(profile.totalElapsedMillis() >= 0, "Elapsed time summed");
  }

  @Test
  void budgetStopsAreReportedPerRun() {
    TractabilityProfile profile = new TractabilityProfiler().profile(2, 2, 50);

    assertEquals(TerminationReason.COMPLETE, profile.runs().get(0).terminationReason(), "n=1");
    assertEquals(
        TerminationReason.FORMULA_BUDGET, profile.runs().get(1).terminationReason(), "n=2");
  }

  @Test
  void rejectsOutOfRangeMaximum() {
    assertThrows(
        IllegalArgumentException.class, () -> new TractabilityProfiler().profile(6, 1, 100));
  }
}
