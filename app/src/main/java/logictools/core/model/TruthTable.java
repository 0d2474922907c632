package logictools.core.model;

/**
 * Output column of a formula over all {@code 2^n} assignments, packed into a {@code long}.
 *
 * <p>Bit {@code a} holds the output under assignment {@code a}; variable {@code v} takes the value
 * of bit {@code v} of {@code a}. Two formulas denote the same function iff their tables are equal.
 */
public record TruthTable(int variableCount, long bits) {
  public static final int MAX_VARIABLES = 5;

  public TruthTable {
    checkVariableCount(variableCount);
    if ((bits & ~fullMask(variableCount)) != 0) {
      throw new IllegalArgumentException(
          "bits exceed " + rowCount(variableCount) + " rows: " + Long.toHexString(bits));
    }
  }

  public static TruthTable of(int variableCount, long bits) {
    return new TruthTable(variableCount, bits);
  }

  /** Builds a table from outputs listed in assignment order, e.g. {@code 0,1,1,0} for XOR. */
  public static TruthTable ofRows(int variableCount, int... rows) {
    checkVariableCount(variableCount);
    if (rows.length != rowCount(variableCount)) {
      throw new IllegalArgumentException(
          "expected " + rowCount(variableCount) + " rows, got " + rows.length);
    }
    long bits = 0;
    for (int a = 0; a < rows.length; a++) {
      if (rows[a] != 0) {
        bits |= 1L << a;
      }
    }
    return new TruthTable(variableCount, bits);
  }

  public static int rowCount(int variableCount) {
    return 1 << variableCount;
  }

  /** Mask with one set bit per assignment. */
  public static long fullMask(int variableCount) {
    return (1L << rowCount(variableCount)) - 1;
  }

  /** Number of distinct functions of {@code variableCount} inputs, {@code 2^(2^n)}. */
  public static long possibleTables(int variableCount) {
    checkVariableCount(variableCount);
    return 1L << rowCount(variableCount);
  }

  public int length() {
    return rowCount(variableCount);
  }

  public boolean valueAt(int assignment) {
    if (assignment < 0 || assignment >= length()) {
      throw new IndexOutOfBoundsException("assignment " + assignment + " of " + length());
    }
    return ((bits >>> assignment) & 1L) != 0;
  }

  /** Table index used for page titles; equal to the packed bits read as an unsigned number. */
  public long index() {
    return bits;
  }

  /** Rows in assignment order as {@code 0}/{@code 1} characters, e.g. {@code 0110}. */
  public String rows() {
    StringBuilder builder = new StringBuilder(length());
    for (int a = 0; a < length(); a++) {
      builder.append(valueAt(a) ? '1' : '0');
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return "TruthTable[n=" + variableCount + ", rows=" + rows() + "]";
  }

  private static void checkVariableCount(int variableCount) {
    if (variableCount < 1 || variableCount > MAX_VARIABLES) {
      throw new IllegalArgumentException(
          "variable count must be between 1 and " + MAX_VARIABLES + ": " + variableCount);
    }
  }
}
