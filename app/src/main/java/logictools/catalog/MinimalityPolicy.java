package logictools.catalog;

/**
 * Decides how a newly ingested formula compares with the current minimal record of its table.
 *
 * <p>Minimal means fewest binary operators. Formulas tied on that count are all kept, listed in
 * discovery order; any secondary ordering belongs to presentation code.
 */
@FunctionalInterface
public interface MinimalityPolicy {

  MinimalityPolicy FEWEST_BINARY_OPERATORS =
      (candidateCount, incumbentCount) -> {
        if (candidateCount < incumbentCount) {
          return Verdict.DETHRONES;
        }
        return candidateCount == incumbentCount ? Verdict.TIES : Verdict.LOSES;
      };

  Verdict judge(int candidateCount, int incumbentCount);

  /** Outcome of one ingestion against its entry. */
  enum Verdict {
    /** First formula seen for the table; it becomes the minimal record. */
    FIRST,
    /** Strictly smaller than the recorded minimum; replaces the minimal list. */
    DETHRONES,
    /** Same operator count as the minimum; appended to the minimal list. */
    TIES,
    /** Larger than the minimum; only recorded among all formulas. */
    LOSES
  }
}
