package logictools.core.model;

import java.util.Objects;

/**
 * Immutable boolean expression tree over variables {@code 0..n-1}.
 *
 * <p>Equality is structural. Subtrees are shared freely between parents; nothing ever mutates a
 * node once built.
 */
public sealed interface Formula permits Literal, Not, BinaryOp {

  /** Number of binary-operator nodes. Negation does not count. */
  int operatorCount();

  /** Highest variable index referenced by this tree. */
  int maxVariable();

  static Formula variable(int index) {
    return new Literal(index);
  }

  static Formula not(Formula operand) {
    return new Not(operand);
  }

  static Formula and(Formula left, Formula right) {
    return new BinaryOp(Operator.AND, left, right);
  }

  static Formula or(Formula left, Formula right) {
    return new BinaryOp(Operator.OR, left, right);
  }

  static Formula xor(Formula left, Formula right) {
    return new BinaryOp(Operator.XOR, left, right);
  }

  static Formula apply(Operator operator, Formula left, Formula right) {
    return new BinaryOp(Objects.requireNonNull(operator, "operator"), left, right);
  }
}
