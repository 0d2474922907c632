package logictools.generate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import logictools.core.model.Formula;

/**
 * Arena of generated formulas, bucketed by operator count.
 *
 * <p>Bucket {@code k} holds every formula with exactly {@code k} binary operators in generation
 * order. Buckets are appended in increasing {@code k}, become read-only once added, and are never
 * released during a run because every larger size class is assembled from them.
 */
public final class FormulaPool {
  private final List<List<Formula>> buckets = new ArrayList<>();
  private long totalFormulas;

  /** Number of complete size classes; also the operator count of the next one to build. */
  public int completedSizeClasses() {
    return buckets.size();
  }

  public boolean hasSizeClass(int operatorCount) {
    return operatorCount >= 0 && operatorCount < buckets.size();
  }

  public List<Formula> sizeClass(int operatorCount) {
    checkSizeClass(operatorCount);
    return buckets.get(operatorCount);
  }

  public Formula get(int operatorCount, int index) {
    return sizeClass(operatorCount).get(index);
  }

  public long totalFormulas() {
    return totalFormulas;
  }

  void append(int operatorCount, List<Formula> formulas) {
    Objects.requireNonNull(formulas, "formulas");
    if (operatorCount != buckets.size()) {
      throw new IllegalStateException(
          "size class " + operatorCount + " appended out of order; expected " + buckets.size());
    }
    buckets.add(Collections.unmodifiableList(formulas));
    totalFormulas += formulas.size();
  }

  private void checkSizeClass(int operatorCount) {
    if (!hasSizeClass(operatorCount)) {
      throw new IndexOutOfBoundsException(
          "size class " + operatorCount + " not built (have " + buckets.size() + ")");
    }
  }
}
