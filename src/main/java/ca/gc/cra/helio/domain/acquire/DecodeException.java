package ca.gc.cra.helio.domain.acquire;

/**
 * Raised when fetched bytes cannot be turned into a normalized raster.
 *
 * @since 0.1.0
 */
public final class DecodeException extends ChannelException {
  private static final long serialVersionUID = 1L;

  public DecodeException(int channelId, String message) {
    super(channelId, message, null);
  }

  public DecodeException(int channelId, String message, Throwable cause) {
    super(channelId, message, cause);
  }
}
