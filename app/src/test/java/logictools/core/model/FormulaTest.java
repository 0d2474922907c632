package logictools.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class FormulaTest {

  @Test
  void negationIsFree() {
    Formula p1 = Formula.variable(0);
    Formula p2 = Formula.variable(1);

    assertEquals(0, Formula.not(Formula.not(p1)).operatorCount(), "Negations cost nothing");
    assertEquals(1, Formula.not(Formula.and(p1, p2)).operatorCount(), "One binary node");
    assertEquals(
        3,
        Formula.or(Formula.and(p1, p2), Formula.xor(p2, Formula.not(p1))).operatorCount(),
        "Three binary nodes");
  }

  @Test
  void equalityIsStructural() {
    Formula left = Formula.and(Formula.variable(0), Formula.variable(1));
    Formula same = Formula.and(Formula.variable(0), Formula.variable(1));
    Formula swapped = Formula.and(Formula.variable(1), Formula.variable(0));

    assertEquals(left, same, "Identical trees are equal");
    assertEquals(left.hashCode(), same.hashCode(), "Equal trees share a hash");
    assertNotEquals(left, swapped, "Commuted operands are a different tree");
  }

  @Test
  void maxVariableScansWholeTree() {
    Formula formula = Formula.xor(Formula.variable(0), Formula.not(Formula.variable(3)));

    assertEquals(3, formula.maxVariable(), "Highest referenced variable");
  }

  @Test
  void rejectsNegativeVariable() {
    assertThrows(IllegalArgumentException.class, () -> Formula.variable(-1));
  }
}
