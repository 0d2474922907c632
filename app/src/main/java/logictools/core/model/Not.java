package logictools.core.model;

import java.util.Objects;

/** Negation of a subformula. Free with respect to {@link Formula#operatorCount()}. */
public record Not(Formula operand) implements Formula {
  public Not {
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public int operatorCount() {
    return operand.operatorCount();
  }

  @Override
  public int maxVariable() {
    return operand.maxVariable();
  }
}
