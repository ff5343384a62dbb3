package ca.gc.cra.helio.domain.acquire;

import java.util.Objects;

/**
 * Diagnostic record of a channel that produced no result.
 *
 * @param channelId channel that failed
 * @param kind failure category
 * @param message human readable cause
 * @since 0.1.0
 */
public record ChannelFailure(int channelId, Kind kind, String message) {
  /** Failure categories attributed to a single channel. */
  public enum Kind {
    /** Non-success status, network failure, or empty body. */
    TRANSPORT,
    /** Malformed encoding or dimension/length mismatch. */
    DECODE
  }

  public ChannelFailure {
    Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
  }

  /**
   * Builds a failure record from a channel exception.
   *
   * @param ex exception raised by the fetch or normalize step
   * @return failure attributed to the exception's channel
   */
  public static ChannelFailure from(ChannelException ex) {
    Kind kind = ex instanceof DecodeException ? Kind.DECODE : Kind.TRANSPORT;
    return new ChannelFailure(ex.channelId(), kind, ex.detail());
  }
}
