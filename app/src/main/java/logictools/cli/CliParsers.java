package logictools.cli;

import com.google.common.base.Splitter;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import logictools.core.model.Operator;
import logictools.eval.EvaluationStrategy;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code and,or,xor} (names or symbols) into an operator set. */
  static Set<Operator> parseOperators(String raw) {
    if (raw == null || raw.isBlank()) {
      return EnumSet.allOf(Operator.class);
    }
    Set<Operator> operators = EnumSet.noneOf(Operator.class);
    for (String token : LIST_SPLITTER.split(raw)) {
      operators.add(parseOperator(token));
    }
    if (operators.isEmpty()) {
      throw new IllegalArgumentException("Invalid operators: " + raw);
    }
    return operators;
  }

  static EvaluationStrategy parseStrategy(String raw) {
    if (raw == null || raw.isBlank()) {
      return EvaluationStrategy.BITWISE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "bitwise", "bits" -> EvaluationStrategy.BITWISE;
      case "per-assignment", "assignment", "naive" -> EvaluationStrategy.PER_ASSIGNMENT;
      default -> throw new IllegalArgumentException("Invalid strategy: " + raw);
    };
  }

  private static Operator parseOperator(String token) {
    for (Operator operator : Operator.values()) {
      if (operator.symbol().equals(token) || operator.name().equalsIgnoreCase(token)) {
        return operator;
      }
    }
    throw new IllegalArgumentException("Unknown operator: " + token);
  }
}
