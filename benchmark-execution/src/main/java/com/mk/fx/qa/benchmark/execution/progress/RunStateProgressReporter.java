package com.mk.fx.qa.benchmark.execution.progress;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the latest event of every unit, the result log and the final totals of one run in memory
 * so they can be read while the run is in progress.
 */
public class RunStateProgressReporter implements ProgressReporter {

  private final Map<String, UnitStatusEvent> latest = new LinkedHashMap<>();
  private final List<UnitResult> results = new ArrayList<>();
  private AggregateEvent aggregate;

  @Override
  public synchronized void onUnitStatus(UnitStatusEvent event) {
    latest.put(event.unitId(), event);
    if (event.status() == UnitStatus.COMPLETED && event.result() != null) {
      results.add(event.result());
    }
  }

  @Override
  public synchronized void onRunCompleted(AggregateEvent event) {
    aggregate = event;
  }

  /** Latest event per unit, in the order units were first reported. */
  public synchronized List<UnitStatusEvent> unitStates() {
    return List.copyOf(latest.values());
  }

  public synchronized List<UnitResult> results() {
    return List.copyOf(results);
  }

  public synchronized Optional<AggregateEvent> aggregate() {
    return Optional.ofNullable(aggregate);
  }

  public synchronized long count(UnitStatus status) {
    return latest.values().stream().filter(e -> e.status() == status).count();
  }
}
