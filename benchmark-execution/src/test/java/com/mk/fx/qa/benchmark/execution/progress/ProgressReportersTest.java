package com.mk.fx.qa.benchmark.execution.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.mk.fx.qa.benchmark.execution.compare.ComparisonReport;
import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.support.RecordingProgressReporter;
import com.mk.fx.qa.benchmark.execution.trial.TrialMeasurement;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;
import com.mk.fx.qa.benchmark.execution.verdict.Winner;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ProgressReportersTest {

  private static UnitStatusEvent event(String unitId, UnitStatus status, int percent) {
    UnitResult result = null;
    if (status == UnitStatus.COMPLETED) {
      var m = new TrialMeasurement(5, true, null, 0, List.of(5L), 1, null);
      result =
          new UnitResult(unitId, unitId, m, m, Winner.TIE, ComparisonReport.empty("x"), Instant.EPOCH);
    }
    return new UnitStatusEvent(unitId, unitId, status, percent, null, null, null, result);
  }

  @Test
  void composite_keepsDeliveringWhenOneDelegateThrows() {
    var failing = mock(ProgressReporter.class);
    doThrow(new IllegalStateException("socket closed")).when(failing).onUnitStatus(any());
    doThrow(new IllegalStateException("socket closed")).when(failing).onRunCompleted(any());
    var recording = new RecordingProgressReporter();
    var composite = new CompositeProgressReporter(List.of(failing, recording));

    composite.onUnitStatus(event("u1", UnitStatus.QUEUED, 0));
    composite.onRunCompleted(AggregateEvent.of(RunningTotals.EMPTY, false));

    verify(failing).onUnitStatus(any());
    assertThat(recording.unitEvents()).hasSize(1);
    assertThat(recording.runEvents()).hasSize(1);
  }

  @Test
  void async_deliversInOrderAndDrainsOnClose() {
    var recording = new RecordingProgressReporter();
    try (var async = new AsyncProgressReporter(recording, "progress-test", Duration.ofSeconds(5))) {
      IntStream.rangeClosed(1, 50)
          .forEach(i -> async.onUnitStatus(event("u1", UnitStatus.RUNNING, i)));
      async.onRunCompleted(AggregateEvent.of(RunningTotals.EMPTY, true));
    }

    assertThat(recording.runningPercentsFor("u1"))
        .containsExactlyElementsOf(IntStream.rangeClosed(1, 50).boxed().toList());
    assertThat(recording.runEvents()).singleElement().matches(AggregateEvent::cancelled);
  }

  @Test
  void async_survivesDelegateFailureAndDropsEventsAfterClose() {
    var recording = new RecordingProgressReporter();
    var calls = new int[] {0};
    ProgressReporter flaky =
        new ProgressReporter() {
          @Override
          public void onUnitStatus(UnitStatusEvent event) {
            if (calls[0]++ == 0) {
              throw new IllegalStateException("first delivery fails");
            }
            recording.onUnitStatus(event);
          }

          @Override
          public void onRunCompleted(AggregateEvent event) {
            recording.onRunCompleted(event);
          }
        };
    var async = new AsyncProgressReporter(flaky, "progress-test", Duration.ofSeconds(5));

    async.onUnitStatus(event("u1", UnitStatus.QUEUED, 0));
    async.onUnitStatus(event("u1", UnitStatus.RUNNING, 10));
    await().atMost(Duration.ofSeconds(5)).until(() -> recording.unitEvents().size() == 1);
    async.close();
    async.onUnitStatus(event("u1", UnitStatus.RUNNING, 20));

    assertThat(recording.runningPercentsFor("u1")).containsExactly(10);
  }

  @Test
  void runState_tracksLatestStatePerUnitAndResults() {
    var state = new RunStateProgressReporter();

    state.onUnitStatus(event("u1", UnitStatus.QUEUED, 0));
    state.onUnitStatus(event("u2", UnitStatus.QUEUED, 0));
    state.onUnitStatus(event("u1", UnitStatus.RUNNING, 50));
    state.onUnitStatus(event("u1", UnitStatus.COMPLETED, 100));
    state.onUnitStatus(event("u2", UnitStatus.FAILED, 0));

    assertThat(state.unitStates()).extracting(UnitStatusEvent::unitId).containsExactly("u1", "u2");
    assertThat(state.count(UnitStatus.COMPLETED)).isEqualTo(1);
    assertThat(state.count(UnitStatus.FAILED)).isEqualTo(1);
    assertThat(state.results()).extracting(UnitResult::unitId).containsExactly("u1");
    assertThat(state.aggregate()).isEmpty();

    state.onRunCompleted(AggregateEvent.of(RunningTotals.EMPTY, false));
    assertThat(state.aggregate()).isPresent();
  }

  @Test
  void aggregateEvent_copiesTotals() {
    var totals = new RunningTotals(2, 1, 1, 30, 50, 1000, 400);

    var event = AggregateEvent.of(totals, false);

    assertThat(event.unitsCompleted()).isEqualTo(2);
    assertThat(event.averageDurationA()).isEqualTo(15.0);
    assertThat(event.averageDurationB()).isEqualTo(25.0);
    assertThat(event.totalPayloadA()).isEqualTo(1000);
    assertThat(event.averagePayloadB()).isEqualTo(200.0);
    assertThat(event.successRate()).isEqualTo(100.0);
    assertThat(event.cancelled()).isFalse();
  }
}
