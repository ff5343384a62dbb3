package ca.gc.cra.helio.domain.acquire;

/**
 * Fatal reconciliation failure: the reference or single channel failed, or no channel succeeded.
 *
 * <p>Aborts the run before any output is written.</p>
 *
 * @since 0.1.0
 */
public final class AcquisitionException extends Exception {
  private static final long serialVersionUID = 1L;

  public AcquisitionException(String message) {
    super(message);
  }

  public AcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
