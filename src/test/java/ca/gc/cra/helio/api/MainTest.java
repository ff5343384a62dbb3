package ca.gc.cra.helio.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: helio <acquire|inspect>"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: helio <acquire|inspect>"));
  }

  @Test
  void commandHelpIsRoutedToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"inspect", "-h"}));
    assertTrue(buffer.toString().contains("HELIO inspect"));
  }
}
