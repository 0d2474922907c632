package logictools.cli;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main -n 3 -output html} enumerates formulas over three variables and writes HTML
 *   <li>{@code Main profile --max-n 4} shows how far exhaustive enumeration gets per n
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_USAGE = 2;
  static final int EXIT_IO = 1;

  static final String USAGE =
      """
      Usage:
        run [-n N] [--output text|html|json] [--max-operators K] [--max-formulas M]
            [--time-budget-ms T] [--operators and,or,xor] [--strategy bitwise|per-assignment]
            [--parallel] [--parallelism P] [--stop-when-complete] [--output-dir DIR]
        profile [--max-n N] [--max-operators K] [--max-formulas M]
      N is the number of variables (1-5, default 3). Reports go to ~/Documents/Logic Tools
      unless --output-dir is given.""";

  private Main() {}

  public static void main(String[] args) {
    int exit = execute(args);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int execute(String[] args) {
    String[] effectiveArgs = args == null ? new String[0] : args;
    try {
      if (effectiveArgs.length > 0 && "profile".equalsIgnoreCase(effectiveArgs[0])) {
        return new ProfileCommand().execute(effectiveArgs);
      }
      return new RunCommand().execute(effectiveArgs);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      LOG.info(USAGE);
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("Failed to write report", ex);
      return EXIT_IO;
    }
  }
}
