package logictools.generate;

import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import logictools.core.model.Formula;
import logictools.core.model.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exhaustive formula enumeration in increasing operator count.
 *
 * <p>Size class 0 is every literal and its negation. Size class {@code k > 0} combines, for each
 * operator and each split {@code i + (k-1-i)}, every formula of size {@code i} with every formula
 * of size {@code k-1-i}, emitting each node followed by its negation. The construction is
 * injective, so no two emitted trees are structurally equal and no dedup pass is needed.
 *
 * <p>Iteration is lazy at size-class granularity and restartable: each {@link #iterator()} starts
 * again from size 0 and reuses the buckets already held by the {@link FormulaPool}.
 */
public final class FormulaGenerator implements Iterable<Formula> {
  private static final Logger LOG = LoggerFactory.getLogger(FormulaGenerator.class);
  private static final int MAX_BUCKET_SIZE = Integer.MAX_VALUE - 8;

  private final int variableCount;
  private final List<Operator> operators;
  private final int maxOperatorCount;
  private final FormulaPool pool = new FormulaPool();

  public FormulaGenerator(int variableCount, Set<Operator> operators, int maxOperatorCount) {
    if (variableCount < 1) {
      throw new IllegalArgumentException("variableCount must be >= 1");
    }
    Objects.requireNonNull(operators, "operators");
    if (operators.isEmpty()) {
      throw new IllegalArgumentException("at least one binary operator is required");
    }
    if (maxOperatorCount < 0) {
      throw new IllegalArgumentException("maxOperatorCount must be >= 0");
    }
    this.variableCount = variableCount;
    this.operators = List.copyOf(EnumSet.copyOf(operators));
    this.maxOperatorCount = maxOperatorCount;
  }

  public int variableCount() {
    return variableCount;
  }

  public List<Operator> operators() {
    return operators;
  }

  public int maxOperatorCount() {
    return maxOperatorCount;
  }

  public FormulaPool pool() {
    return pool;
  }

  /**
   * Exact number of formulas in size class {@code k}, computed from the counts of the smaller
   * classes without building anything. Saturates at {@link Long#MAX_VALUE}.
   */
  public long plannedSize(int operatorCount) {
    return sizeClassCounts(variableCount, operators.size(), operatorCount)[operatorCount];
  }

  /** Counts for size classes {@code 0..maxOperatorCount}, saturating on overflow. */
  public static long[] sizeClassCounts(int variableCount, int operatorKinds, int maxOperatorCount) {
    if (maxOperatorCount < 0) {
      throw new IllegalArgumentException("maxOperatorCount must be >= 0");
    }
    long[] counts = new long[maxOperatorCount + 1];
    counts[0] = 2L * variableCount;
    for (int k = 1; k <= maxOperatorCount; k++) {
      long pairs = 0;
      for (int i = 0; i < k; i++) {
        pairs =
            LongMath.saturatedAdd(
                pairs, LongMath.saturatedMultiply(counts[i], counts[k - 1 - i]));
      }
      counts[k] = LongMath.saturatedMultiply(pairs, 2L * operatorKinds);
    }
    return counts;
  }

  /**
   * Returns size class {@code k}, building it and any missing smaller classes first. The returned
   * list is the pool's own read-only bucket.
   */
  public List<Formula> buildSizeClass(int operatorCount) {
    if (operatorCount < 0 || operatorCount > maxOperatorCount) {
      throw new IllegalArgumentException(
          "size class " + operatorCount + " outside 0.." + maxOperatorCount);
    }
    while (pool.completedSizeClasses() <= operatorCount) {
      int next = pool.completedSizeClasses();
      pool.append(next, next == 0 ? literals() : combine(next));
    }
    return pool.sizeClass(operatorCount);
  }

  @Override
  public Iterator<Formula> iterator() {
    return new SizeOrderedIterator();
  }

  private List<Formula> literals() {
    List<Formula> out = new ArrayList<>(2 * variableCount);
    for (int v = 0; v < variableCount; v++) {
      Formula literal = Formula.variable(v);
      out.add(literal);
      out.add(Formula.not(literal));
    }
    return out;
  }

  private List<Formula> combine(int operatorCount) {
    long planned = plannedSize(operatorCount);
    if (planned > MAX_BUCKET_SIZE) {
      throw new IllegalStateException(
          "size class " + operatorCount + " would hold " + planned + " formulas");
    }
    LOG.debug("Building size class {} ({} formulas)", operatorCount, planned);
    List<Formula> out = new ArrayList<>((int) planned);
    for (Operator operator : operators) {
      for (int leftSize = 0; leftSize < operatorCount; leftSize++) {
        List<Formula> lefts = pool.sizeClass(leftSize);
        List<Formula> rights = pool.sizeClass(operatorCount - 1 - leftSize);
        for (Formula left : lefts) {
          for (Formula right : rights) {
            Formula node = Formula.apply(operator, left, right);
            out.add(node);
            out.add(Formula.not(node));
          }
        }
      }
    }
    return out;
  }

  private final class SizeOrderedIterator implements Iterator<Formula> {
    private int sizeClass;
    private int index;
    private List<Formula> current = List.of();

    @Override
    public boolean hasNext() {
      while (index >= current.size()) {
        if (sizeClass > maxOperatorCount) {
          return false;
        }
        current = buildSizeClass(sizeClass++);
        index = 0;
      }
      return true;
    }

    @Override
    public Formula next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.get(index++);
    }
  }
}
