package ca.gc.cra.helio.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helio.domain.acquire.AcquisitionException;
import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.acquire.AcquisitionPlan;
import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.acquire.TransportException;
import ca.gc.cra.helio.testutil.RecordingMetrics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AcquisitionOrchestratorTest {
  private static final Instant NOMINAL = Instant.parse("2025-12-30T14:00:00Z");

  private final List<ChannelRequest> calls = Collections.synchronizedList(new ArrayList<>());

  @Test
  void independentUsesLatestCaptureAndKeepsRequestOrder() throws Exception {
    AcquisitionOrchestrator orchestrator = orchestrator(
        Map.of(9, NOMINAL.minusSeconds(6), 10, NOMINAL.plusSeconds(3), 11, NOMINAL.minusSeconds(1)), Set.of());

    AcquisitionOutcome outcome = orchestrator.acquire(NOMINAL, AcquisitionPlan.independent(List.of(9, 10, 11)));

    assertEquals(NOMINAL.plusSeconds(3), outcome.canonicalTimestamp());
    assertEquals(List.of(9, 10, 11), ids(outcome.successfulResults()));
    assertTrue(outcome.failures().isEmpty());
  }

  @Test
  void independentToleratesPartialFailure() throws Exception {
    AcquisitionOrchestrator orchestrator = orchestrator(
        Map.of(9, NOMINAL, 11, NOMINAL.minusSeconds(2)), Set.of(10));

    AcquisitionOutcome outcome = orchestrator.acquire(NOMINAL, AcquisitionPlan.independent(List.of(9, 10, 11)));

    assertEquals(List.of(9, 11), ids(outcome.successfulResults()));
    assertEquals(1, outcome.failures().size());
    ChannelFailure failure = outcome.failures().get(0);
    assertEquals(10, failure.channelId());
    assertEquals(ChannelFailure.Kind.TRANSPORT, failure.kind());
    assertEquals("HTTP 404 from test", failure.message());
  }

  @Test
  void anchoredRequestsSecondWaveAtReferenceCaptureAndAppendsReferenceLast() throws Exception {
    Instant anchor = NOMINAL.minusSeconds(5);
    AcquisitionOrchestrator orchestrator = orchestrator(
        Map.of(19, anchor, 9, anchor.plusSeconds(1), 10, anchor.minusSeconds(1)), Set.of());

    AcquisitionOutcome outcome = orchestrator.acquire(NOMINAL, AcquisitionPlan.anchored(19, List.of(9, 10)));

    assertEquals(anchor, outcome.canonicalTimestamp());
    assertEquals(List.of(9, 10, 19), ids(outcome.successfulResults()));
    assertEquals(new ChannelRequest(19, NOMINAL), calls.get(0));
    assertTrue(calls.subList(1, calls.size()).stream().allMatch(r -> r.nominalTimestamp().equals(anchor)),
        "second wave must be requested at the reference capture time");
  }

  @Test
  void anchoredReferenceFailureIsFatalAndSkipsSecondWave() {
    AcquisitionOrchestrator orchestrator = orchestrator(Map.of(9, NOMINAL, 10, NOMINAL), Set.of(19));

    AcquisitionException ex = assertThrows(AcquisitionException.class,
        () -> orchestrator.acquire(NOMINAL, AcquisitionPlan.anchored(19, List.of(9, 10))));

    assertEquals("reference channel 19 failed: HTTP 404 from test", ex.getMessage());
    assertEquals(1, calls.size());
  }

  @Test
  void anchoredSecondWaveFailuresStillProduceOutcome() throws Exception {
    AcquisitionOrchestrator orchestrator = orchestrator(Map.of(19, NOMINAL), Set.of(9, 10));

    AcquisitionOutcome outcome = orchestrator.acquire(NOMINAL, AcquisitionPlan.anchored(19, List.of(9, 10)));

    assertEquals(List.of(19), ids(outcome.successfulResults()));
    assertEquals(2, outcome.failures().size());
  }

  @Test
  void singleFailureIsFatal() {
    AcquisitionOrchestrator orchestrator = orchestrator(Map.of(), Set.of(4));

    AcquisitionException ex = assertThrows(AcquisitionException.class,
        () -> orchestrator.acquire(NOMINAL, AcquisitionPlan.single(4)));
    assertEquals("channel 4 failed: HTTP 404 from test", ex.getMessage());
  }

  @Test
  void singleUsesItsOwnCaptureTime() throws Exception {
    AcquisitionOrchestrator orchestrator = orchestrator(Map.of(4, NOMINAL.minusSeconds(9)), Set.of());

    AcquisitionOutcome outcome = orchestrator.acquire(NOMINAL, AcquisitionPlan.single(4));

    assertEquals(NOMINAL.minusSeconds(9), outcome.canonicalTimestamp());
  }

  @Test
  void noSuccessesRaisesNoChannelsAcquired() {
    AcquisitionOrchestrator orchestrator = orchestrator(Map.of(), Set.of(9, 10));

    AcquisitionException ex = assertThrows(AcquisitionException.class,
        () -> orchestrator.acquire(NOMINAL, AcquisitionPlan.independent(List.of(9, 10))));
    assertEquals("no channels acquired", ex.getMessage());
  }

  private AcquisitionOrchestrator orchestrator(Map<Integer, Instant> captures, Set<Integer> failing) {
    ChannelAcquirer acquirer = request -> {
      calls.add(request);
      int id = request.channelId();
      Instant captured = captures.get(id);
      if (captured == null || failing.contains(id)) {
        throw new TransportException(id, "HTTP 404 from test");
      }
      return new ChannelResult(id, captured, new byte[] {(byte) id}, 1, 1);
    };
    return new AcquisitionOrchestrator(new WaveExecutor(acquirer, 4, new RecordingMetrics()));
  }

  private static List<Integer> ids(List<ChannelResult> results) {
    return results.stream().map(ChannelResult::channelId).toList();
  }
}
