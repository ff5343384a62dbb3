package ca.gc.cra.helio.domain.acquire;

/**
 * Failure attributed to a single channel of an acquisition wave.
 *
 * <p>Channel failures never abort a wave; the wave converts them into {@link ChannelFailure} records.</p>
 *
 * @since 0.1.0
 */
public abstract class ChannelException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int channelId;
  private final String detail;

  protected ChannelException(int channelId, String message, Throwable cause) {
    super("channel " + channelId + ": " + message, cause);
    this.channelId = channelId;
    this.detail = message == null ? "" : message;
  }

  /**
   * Returns the channel the failure is attributed to.
   *
   * @return channel identifier
   */
  public int channelId() {
    return channelId;
  }

  /**
   * Returns the failure description without the channel prefix carried by {@link #getMessage()}.
   *
   * @return failure detail
   */
  public String detail() {
    return detail;
  }
}
