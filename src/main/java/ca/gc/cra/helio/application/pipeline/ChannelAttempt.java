package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one wave task: exactly one of a result or a failure.
 *
 * @param request request the task ran
 * @param result successful result, if any
 * @param failure failure, if the task did not succeed
 * @since 0.1.0
 */
public record ChannelAttempt(ChannelRequest request, Optional<ChannelResult> result, Optional<ChannelFailure> failure) {
  public ChannelAttempt {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(failure, "failure");
    if (result.isPresent() == failure.isPresent()) {
      throw new IllegalArgumentException("attempt must hold exactly one of result or failure");
    }
  }

  static ChannelAttempt succeeded(ChannelRequest request, ChannelResult result) {
    return new ChannelAttempt(request, Optional.of(result), Optional.empty());
  }

  static ChannelAttempt failed(ChannelRequest request, ChannelFailure failure) {
    return new ChannelAttempt(request, Optional.empty(), Optional.of(failure));
  }

  /**
   * Returns whether the task produced a result.
   *
   * @return {@code true} on success
   */
  public boolean succeeded() {
    return result.isPresent();
  }
}
