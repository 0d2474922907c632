package logictools.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class TruthTableTest {

  @Test
  void rowsAreListedInAssignmentOrder() {
    TruthTable xor = TruthTable.ofRows(2, 0, 1, 1, 0);

    assertEquals(4, xor.length(), "Two variables give four rows");
    assertEquals("0110", xor.rows(), "Rows should read back in assignment order");
    assertEquals(0b0110L, xor.bits(), "Bit a should hold the output of assignment a");
    assertFalse(xor.valueAt(0), "XOR(F,F) is false");
    assertTrue(xor.valueAt(1), "XOR(T,F) is true");
  }

  @Test
  void possibleTablesIsDoubleExponential() {
    assertEquals(4, TruthTable.possibleTables(1), "n=1");
    assertEquals(16, TruthTable.possibleTables(2), "n=2");
    assertEquals(256, TruthTable.possibleTables(3), "n=3");
    assertEquals(65_536, TruthTable.possibleTables(4), "n=4");
    assertEquals(1L << 32, TruthTable.possibleTables(5), "n=5");
  }

  @Test
  void equalityIncludesWidth() {
    assertEquals(TruthTable.of(2, 0b1000), TruthTable.ofRows(2, 0, 0, 0, 1), "Same bits, same n");
    assertNotEquals(
        TruthTable.of(1, 0b10), TruthTable.of(2, 0b10), "Tables of different widths differ");
  }

  @Test
  void rejectsBitsBeyondWidthAndBadCounts() {
    assertThrows(IllegalArgumentException.class, () -> TruthTable.of(1, 0b100));
    assertThrows(IllegalArgumentException.class, () -> TruthTable.of(0, 0));
    assertThrows(IllegalArgumentException.class, () -> TruthTable.of(6, 0));
    assertThrows(IllegalArgumentException.class, () -> TruthTable.ofRows(2, 1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> TruthTable.of(1, 0).valueAt(2));
  }

  @Test
  void fiveVariableTableFillsLowerThirtyTwoBits() {
    TruthTable allTrue = TruthTable.of(5, TruthTable.fullMask(5));

    assertEquals(0xFFFF_FFFFL, allTrue.bits(), "All 32 rows set should fill the lower 32 bits");
    assertEquals(32, allTrue.rows().length(), "32 rows expected");
  }
}
