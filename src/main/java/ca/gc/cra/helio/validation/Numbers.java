package ca.gc.cra.helio.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by HELIO CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid channel ids, raster sizes, timeouts, and pool sizes before
 * the acquire pipeline allocates threads or buffers.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., pixels, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and lies within {@code (0, max]}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is not finite or outside {@code (0, max]}
   */
  public static double requirePositive(String name, double value, double max) {
    if (!Double.isFinite(value) || value <= 0.0 || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be greater than 0 and at most " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer option and validates its range.
   *
   * @param name option name used in diagnostics
   * @param raw raw text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    try {
      return (int) requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
