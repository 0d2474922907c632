package logictools.eval;

import java.util.Objects;
import logictools.core.model.BinaryOp;
import logictools.core.model.Formula;
import logictools.core.model.Literal;
import logictools.core.model.Not;
import logictools.core.model.TruthTable;

/**
 * Computes the truth table of a formula over a fixed number of variables.
 *
 * <p>Instances are immutable and safe to share between evaluation workers.
 */
public final class TruthTableEvaluator {
  private final int variableCount;
  private final EvaluationStrategy strategy;
  private final long fullMask;
  private final long[] literalMasks;

  public TruthTableEvaluator(int variableCount) {
    this(variableCount, EvaluationStrategy.BITWISE);
  }

  public TruthTableEvaluator(int variableCount, EvaluationStrategy strategy) {
    this.fullMask = TruthTable.fullMask(checkedCount(variableCount));
    this.variableCount = variableCount;
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.literalMasks = literalMasks(variableCount);
  }

  public int variableCount() {
    return variableCount;
  }

  public EvaluationStrategy strategy() {
    return strategy;
  }

  public TruthTable evaluate(Formula formula) {
    Objects.requireNonNull(formula, "formula");
    if (formula.maxVariable() >= variableCount) {
      throw new IllegalArgumentException(
          "formula references variable " + formula.maxVariable() + " but n=" + variableCount);
    }
    long bits = strategy == EvaluationStrategy.BITWISE ? bitsOf(formula) : perAssignment(formula);
    return new TruthTable(variableCount, bits);
  }

  /** Output of {@code formula} under one assignment; variable {@code v} reads bit {@code v}. */
  public boolean valueAt(Formula formula, int assignment) {
    if (formula instanceof Literal literal) {
      return ((assignment >>> literal.variable()) & 1) != 0;
    }
    if (formula instanceof Not not) {
      return !valueAt(not.operand(), assignment);
    }
    if (formula instanceof BinaryOp op) {
      return op.operator().apply(valueAt(op.left(), assignment), valueAt(op.right(), assignment));
    }
    throw new IllegalStateException("Unknown formula node: " + formula.getClass());
  }

  private long perAssignment(Formula formula) {
    long bits = 0;
    int rows = TruthTable.rowCount(variableCount);
    for (int a = 0; a < rows; a++) {
      if (valueAt(formula, a)) {
        bits |= 1L << a;
      }
    }
    return bits;
  }

  private long bitsOf(Formula formula) {
    if (formula instanceof Literal literal) {
      return literalMasks[literal.variable()];
    }
    if (formula instanceof Not not) {
      return ~bitsOf(not.operand()) & fullMask;
    }
    if (formula instanceof BinaryOp op) {
      return op.operator().applyBits(bitsOf(op.left()), bitsOf(op.right())) & fullMask;
    }
    throw new IllegalStateException("Unknown formula node: " + formula.getClass());
  }

  // Mask of assignments in which variable v is true.
  private static long[] literalMasks(int variableCount) {
    long[] masks = new long[variableCount];
    int rows = TruthTable.rowCount(variableCount);
    for (int v = 0; v < variableCount; v++) {
      long mask = 0;
      for (int a = 0; a < rows; a++) {
        if (((a >>> v) & 1) != 0) {
          mask |= 1L << a;
        }
      }
      masks[v] = mask;
    }
    return masks;
  }

  private static int checkedCount(int variableCount) {
    if (variableCount < 1 || variableCount > TruthTable.MAX_VARIABLES) {
      throw new IllegalArgumentException("variable count out of range: " + variableCount);
    }
    return variableCount;
  }
}
