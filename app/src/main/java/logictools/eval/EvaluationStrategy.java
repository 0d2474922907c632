package logictools.eval;

/** How {@link TruthTableEvaluator} walks the assignments of a formula. */
public enum EvaluationStrategy {
  /** One recursive interpretation per assignment, {@code 2^n} walks of the tree. */
  PER_ASSIGNMENT,
  /** A single walk over packed literal masks covering every assignment at once. */
  BITWISE
}
