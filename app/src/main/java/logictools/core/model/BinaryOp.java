package logictools.core.model;

import java.util.Objects;

/** Application of a binary connective to two subformulas. */
public record BinaryOp(Operator operator, Formula left, Formula right) implements Formula {
  public BinaryOp {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public int operatorCount() {
    return 1 + left.operatorCount() + right.operatorCount();
  }

  @Override
  public int maxVariable() {
    return Math.max(left.maxVariable(), right.maxVariable());
  }
}
