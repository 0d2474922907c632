package logictools.core.model;

/** Binary connectives used by the generator. Each application counts as one operator. */
public enum Operator {
  AND("&") {
    @Override
    public boolean apply(boolean left, boolean right) {
      return left && right;
    }

    @Override
    public long applyBits(long left, long right) {
      return left & right;
    }
  },
  OR("|") {
    @Override
    public boolean apply(boolean left, boolean right) {
      return left || right;
    }

    @Override
    public long applyBits(long left, long right) {
      return left | right;
    }
  },
  XOR("^") {
    @Override
    public boolean apply(boolean left, boolean right) {
      return left ^ right;
    }

    @Override
    public long applyBits(long left, long right) {
      return left ^ right;
    }
  };

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Truth function of the connective on a single pair of inputs. */
  public abstract boolean apply(boolean left, boolean right);

  /** Same truth function applied bitwise to two packed truth tables. */
  public abstract long applyBits(long left, long right);
}
