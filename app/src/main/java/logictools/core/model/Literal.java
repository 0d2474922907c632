package logictools.core.model;

/** Reference to one input variable. */
public record Literal(int variable) implements Formula {
  public Literal {
    if (variable < 0) {
      throw new IllegalArgumentException("variable must be >= 0");
    }
  }

  @Override
  public int operatorCount() {
    return 0;
  }

  @Override
  public int maxVariable() {
    return variable;
  }
}
