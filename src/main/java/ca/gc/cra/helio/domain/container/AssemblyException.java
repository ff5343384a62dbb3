package ca.gc.cra.helio.domain.container;

/**
 * Fatal assembly failure: wrong channel cardinality, mismatched group lengths, or a value that does not fit its
 * container field. Raised before any byte is written.
 *
 * @since 0.1.0
 */
public final class AssemblyException extends Exception {
  private static final long serialVersionUID = 1L;

  public AssemblyException(String message) {
    super(message);
  }
}
