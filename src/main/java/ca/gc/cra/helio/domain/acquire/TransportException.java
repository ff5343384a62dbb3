package ca.gc.cra.helio.domain.acquire;

/**
 * Raised when the source cannot deliver a channel: non-success status, network failure, or empty body.
 *
 * @since 0.1.0
 */
public final class TransportException extends ChannelException {
  private static final long serialVersionUID = 1L;

  public TransportException(int channelId, String message) {
    super(channelId, message, null);
  }

  public TransportException(int channelId, String message, Throwable cause) {
    super(channelId, message, cause);
  }
}
