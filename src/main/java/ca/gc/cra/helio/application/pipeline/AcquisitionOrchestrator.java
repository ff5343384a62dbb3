package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.AcquisitionException;
import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.acquire.AcquisitionPlan;
import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the waves a plan requires and reconciles the channels' capture instants into one
 * canonical timestamp.
 * <p><strong>Role:</strong> Core of the acquire use case, between the per-channel tasks and the assembler.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each call runs its own waves.</p>
 *
 * <ul>
 *   <li>INDEPENDENT: one wave at the nominal instant; canonical is the latest actual instant.</li>
 *   <li>ANCHORED: the reference channel alone, then the rest at the reference's actual instant; canonical is the
 *       reference instant. The reference result is placed after the second-wave results.</li>
 *   <li>SINGLE: one channel whose failure is fatal.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class AcquisitionOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(AcquisitionOrchestrator.class);

  private final WaveExecutor waves;

  /**
   * Creates an orchestrator.
   *
   * @param waves wave executor
   */
  public AcquisitionOrchestrator(WaveExecutor waves) {
    this.waves = Objects.requireNonNull(waves, "waves");
  }

  /**
   * Acquires every channel of the plan.
   *
   * @param nominal requested capture instant
   * @param plan channels and reconciliation mode
   * @return outcome with at least one successful result
   * @throws AcquisitionException if the reference or single channel fails, or nothing succeeds
   * @throws InterruptedException if interrupted while a wave is running
   */
  public AcquisitionOutcome acquire(Instant nominal, AcquisitionPlan plan)
      throws AcquisitionException, InterruptedException {
    Objects.requireNonNull(nominal, "nominal");
    Objects.requireNonNull(plan, "plan");
    return switch (plan.mode()) {
      case INDEPENDENT -> independent(nominal, plan.channels());
      case ANCHORED -> anchored(nominal, plan.referenceChannel().getAsInt(), plan.channels());
      case SINGLE -> single(nominal, plan.channels().get(0));
    };
  }

  private AcquisitionOutcome independent(Instant nominal, List<Integer> channels)
      throws AcquisitionException, InterruptedException {
    Merge merge = new Merge();
    merge.add(waves.run("wave", requests(channels, nominal)));
    List<ChannelResult> results = merge.requireResults();
    Instant canonical = results.get(0).actualTimestamp();
    for (ChannelResult result : results) {
      if (result.actualTimestamp().isAfter(canonical)) {
        canonical = result.actualTimestamp();
      }
    }
    return new AcquisitionOutcome(canonical, results, merge.failures);
  }

  private AcquisitionOutcome anchored(Instant nominal, int reference, List<Integer> channels)
      throws AcquisitionException, InterruptedException {
    ChannelAttempt anchor = waves.run("reference", List.of(new ChannelRequest(reference, nominal))).get(0);
    if (!anchor.succeeded()) {
      ChannelFailure failure = anchor.failure().orElseThrow();
      throw new AcquisitionException("reference channel " + reference + " failed: " + failure.message());
    }
    ChannelResult anchorResult = anchor.result().orElseThrow();
    Instant canonical = anchorResult.actualTimestamp();
    log.info("Reference channel {} captured at {}; fetching {} more channels", reference, canonical, channels.size());

    Merge merge = new Merge();
    merge.add(waves.run("anchored", requests(channels, canonical)));
    merge.results.add(anchorResult);
    return new AcquisitionOutcome(canonical, merge.requireResults(), merge.failures);
  }

  private AcquisitionOutcome single(Instant nominal, int channel)
      throws AcquisitionException, InterruptedException {
    ChannelAttempt attempt = waves.run("single", List.of(new ChannelRequest(channel, nominal))).get(0);
    if (!attempt.succeeded()) {
      throw new AcquisitionException(
          "channel " + channel + " failed: " + attempt.failure().orElseThrow().message());
    }
    ChannelResult result = attempt.result().orElseThrow();
    return AcquisitionOutcome.of(result.actualTimestamp(), List.of(result));
  }

  private static List<ChannelRequest> requests(List<Integer> channels, Instant nominal) {
    List<ChannelRequest> requests = new ArrayList<>(channels.size());
    for (int channel : channels) {
      requests.add(new ChannelRequest(channel, nominal));
    }
    return requests;
  }

  private static final class Merge {
    private final List<ChannelResult> results = new ArrayList<>();
    private final List<ChannelFailure> failures = new ArrayList<>();

    void add(List<ChannelAttempt> attempts) {
      for (ChannelAttempt attempt : attempts) {
        attempt.result().ifPresent(results::add);
        attempt.failure().ifPresent(failures::add);
      }
    }

    List<ChannelResult> requireResults() throws AcquisitionException {
      if (results.isEmpty()) {
        throw new AcquisitionException("no channels acquired");
      }
      return results;
    }
  }
}
