package ca.gc.cra.helio.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"acquire", "-v", "schema=RAW", "--DRY-RUN", " ", "mode=SINGLE"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag("--allow-overwrite"));
    assertArrayEquals(new String[] {"acquire", "schema=RAW", "mode=SINGLE"}, input.keyValueArgs());
    assertArrayEquals(new String[] {"schema=RAW", "mode=SINGLE"}, input.afterCommand());
  }

  @Test
  void helpAliasesNormalize() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-H"}).help());
    assertArrayEquals(new String[0], CliInput.parse(null).afterCommand());
  }
}
