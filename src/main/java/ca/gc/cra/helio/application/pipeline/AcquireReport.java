package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.container.Container;
import java.util.Objects;

/**
 * Summary of a completed acquire run.
 *
 * @param outcome reconciled acquisition outcome
 * @param container container that was written
 * @param bytesWritten size of the container file in bytes
 * @since 0.1.0
 */
public record AcquireReport(AcquisitionOutcome outcome, Container container, long bytesWritten) {
  public AcquireReport {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(container, "container");
  }
}
