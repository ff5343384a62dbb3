package ca.gc.cra.helio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntValidatesRangeAndSyntax() {
    assertEquals(19, Numbers.parseInt("referenceChannel", " 19 ", 0, 255));

    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("referenceChannel", "256", 0, 255));
    assertTrue(range.getMessage().contains("between 0 and 255"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("maxConcurrency", "six", 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("maxConcurrency", " ", 1, 64));
  }

  @Test
  void requirePositiveRejectsNonFiniteValues() {
    assertEquals(0.5, Numbers.requirePositive("scaleFactor", 0.5, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("scaleFactor", Double.NaN, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("scaleFactor", 0.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("scaleFactor", 1.5, 1.0));
  }
}
