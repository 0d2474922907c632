package logictools.cli;

import logictools.core.model.TruthTable;

record ProfileOptions(int maxVariableCount, int maxOperatorCount, long maxFormulas) {
  static final int DEFAULT_MAX_VARIABLE_COUNT = 4;

  ProfileOptions {
    if (maxVariableCount < 1 || maxVariableCount > TruthTable.MAX_VARIABLES) {
      throw new IllegalArgumentException(
          "--max-n must be between 1 and " + TruthTable.MAX_VARIABLES + ": " + maxVariableCount);
    }
    if (maxFormulas < 1) {
      throw new IllegalArgumentException("--max-formulas must be positive");
    }
  }
}
