package ca.gc.cra.helio.domain.acquire;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Reconciled result of an acquisition run.
 * <p><strong>Role:</strong> Domain value passed from the orchestrator to the container assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable record backed by immutable lists.</p>
 *
 * @param canonicalTimestamp instant representing the whole batch
 * @param successfulResults results in arrival order; never empty
 * @param failures channels that produced no result, for diagnostics
 * @since 0.1.0
 */
public record AcquisitionOutcome(
    Instant canonicalTimestamp, List<ChannelResult> successfulResults, List<ChannelFailure> failures) {

  /**
   * Copies the lists and enforces a non-empty successful set.
   *
   * @throws IllegalArgumentException if {@code successfulResults} is empty
   */
  public AcquisitionOutcome {
    Objects.requireNonNull(canonicalTimestamp, "canonicalTimestamp");
    successfulResults = List.copyOf(Objects.requireNonNull(successfulResults, "successfulResults"));
    failures = failures == null ? List.of() : List.copyOf(failures);
    if (successfulResults.isEmpty()) {
      throw new IllegalArgumentException("successfulResults must not be empty");
    }
  }

  /**
   * Builds an outcome with no recorded failures.
   *
   * @param canonicalTimestamp batch instant
   * @param successfulResults results in arrival order
   * @return outcome instance
   */
  public static AcquisitionOutcome of(Instant canonicalTimestamp, List<ChannelResult> successfulResults) {
    return new AcquisitionOutcome(canonicalTimestamp, successfulResults, List.of());
  }
}
