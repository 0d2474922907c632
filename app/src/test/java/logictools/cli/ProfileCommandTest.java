package logictools.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import logictools.core.EnumerationOptions;
import org.junit.jupiter.api.Test;

final class ProfileCommandTest {

  @Test
  void parsesProfileOptions() {
    ProfileOptions options =
        new ProfileCommand()
            .parseProfileArgs(new String[] {"profile", "--max-n=2", "--max-operators", "1"});

    assertEquals(2, options.maxVariableCount(), "Inline max n");
    assertEquals(1, options.maxOperatorCount(), "Operator ceiling");
    assertEquals(EnumerationOptions.DEFAULT_MAX_FORMULAS, options.maxFormulas(), "Default budget");
  }

  @Test
  void rejectsBadProfileArguments() {
    ProfileCommand command = new ProfileCommand();

    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseProfileArgs(new String[] {"profile", "--max-n", "7"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseProfileArgs(new String[] {"profile", "--other"}));
  }

  @Test
  void mainDispatchesProfile() {
    assertEquals(
        0,
        Main.execute(new String[] {"profile", "--max-n", "2", "--max-operators", "1"}),
        "Profile exits cleanly");
  }
}
