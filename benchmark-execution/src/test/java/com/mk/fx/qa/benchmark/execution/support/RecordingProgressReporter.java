package com.mk.fx.qa.benchmark.execution.support;

import com.mk.fx.qa.benchmark.execution.progress.AggregateEvent;
import com.mk.fx.qa.benchmark.execution.progress.ProgressReporter;
import com.mk.fx.qa.benchmark.execution.progress.UnitStatus;
import com.mk.fx.qa.benchmark.execution.progress.UnitStatusEvent;
import java.util.ArrayList;
import java.util.List;

/** Keeps every event it receives, in order. */
public class RecordingProgressReporter implements ProgressReporter {

  private final List<UnitStatusEvent> unitEvents = new ArrayList<>();
  private final List<AggregateEvent> runEvents = new ArrayList<>();

  @Override
  public synchronized void onUnitStatus(UnitStatusEvent event) {
    unitEvents.add(event);
  }

  @Override
  public synchronized void onRunCompleted(AggregateEvent event) {
    runEvents.add(event);
  }

  public synchronized List<UnitStatusEvent> unitEvents() {
    return List.copyOf(unitEvents);
  }

  public synchronized List<UnitStatusEvent> eventsFor(String unitId) {
    return unitEvents.stream().filter(e -> e.unitId().equals(unitId)).toList();
  }

  public synchronized List<Integer> runningPercentsFor(String unitId) {
    return eventsFor(unitId).stream()
        .filter(e -> e.status() == UnitStatus.RUNNING)
        .map(UnitStatusEvent::percent)
        .toList();
  }

  public synchronized List<AggregateEvent> runEvents() {
    return List.copyOf(runEvents);
  }
}
