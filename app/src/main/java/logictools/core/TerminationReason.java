package logictools.core;

import java.util.Locale;

/** Why an enumeration run stopped. Everything except {@link #COMPLETE} means tables are missing. */
public enum TerminationReason {
  COMPLETE("every truth table was discovered"),
  SIZE_CEILING("operator-count ceiling reached before every truth table was discovered"),
  FORMULA_BUDGET("next size class would exceed the formula budget"),
  MEMORY_BUDGET("next size class would not fit in the remaining heap"),
  TIME_BUDGET("time budget exhausted");

  private final String description;

  TerminationReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /** True when a resource limit, rather than the configured ceiling, ended the run. */
  public boolean budgetExhausted() {
    return this == FORMULA_BUDGET || this == MEMORY_BUDGET || this == TIME_BUDGET;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
