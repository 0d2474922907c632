package logictools.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import logictools.core.model.BinaryOp;
import logictools.core.model.Formula;
import logictools.core.model.Literal;
import logictools.core.model.Not;

/**
 * Renders formulas as infix text, e.g. {@code p1 & (p2 | ~p3)} or {@code ~(p1 ^ p2)}.
 *
 * <p>Operands that are themselves binary nodes are parenthesized; the top level is not.
 */
public final class FormulaFormatter {
  public static final String NEGATION_SYMBOL = "~";

  private final List<String> variableNames;

  public FormulaFormatter(List<String> variableNames) {
    this.variableNames = List.copyOf(Objects.requireNonNull(variableNames, "variableNames"));
  }

  /** Formatter using the names {@code p1..pn}. */
  public static FormulaFormatter forVariables(int variableCount) {
    return new FormulaFormatter(defaultNames(variableCount));
  }

  public static List<String> defaultNames(int variableCount) {
    List<String> names = new ArrayList<>(variableCount);
    for (int i = 1; i <= variableCount; i++) {
      names.add("p" + i);
    }
    return names;
  }

  public List<String> variableNames() {
    return variableNames;
  }

  public String format(Formula formula) {
    Objects.requireNonNull(formula, "formula");
    StringBuilder builder = new StringBuilder();
    append(builder, formula, false);
    return builder.toString();
  }

  public String formatAll(List<Formula> formulas, String separator) {
    StringBuilder builder = new StringBuilder();
    for (Formula formula : formulas) {
      if (builder.length() > 0) {
        builder.append(separator);
      }
      append(builder, formula, false);
    }
    return builder.toString();
  }

  private void append(StringBuilder builder, Formula formula, boolean nested) {
    if (formula instanceof Literal literal) {
      builder.append(nameOf(literal.variable()));
    } else if (formula instanceof Not not) {
      builder.append(NEGATION_SYMBOL);
      append(builder, not.operand(), true);
    } else if (formula instanceof BinaryOp op) {
      if (nested) {
        builder.append('(');
      }
      append(builder, op.left(), true);
      builder.append(' ').append(op.operator().symbol()).append(' ');
      append(builder, op.right(), true);
      if (nested) {
        builder.append(')');
      }
    } else {
      throw new IllegalStateException("Unknown formula node: " + formula.getClass());
    }
  }

  private String nameOf(int variable) {
    if (variable >= variableNames.size()) {
      throw new IllegalArgumentException("no name for variable " + variable);
    }
    return variableNames.get(variable);
  }
}
