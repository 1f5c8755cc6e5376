package com.namekis.gitfleet.fix;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the steps of one action, labelling each with its planned entry and reporting progress to the observer. The first failing
 * step stops the action.
 */
class StepRunner {
  private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

  @FunctionalInterface
  interface Step {
    void run() throws Exception;
  }

  private final Map<String, FixPlanEntry> planById = new LinkedHashMap<>();
  private final StepObserver observer;

  StepRunner(List<FixPlanEntry> plan, StepObserver observer) {
    for (FixPlanEntry entry : plan) {
      if (entry.id() != null && !entry.id().isBlank()) {
        planById.put(entry.id().trim(), entry);
      }
    }
    this.observer = observer == null ? StepObserver.NONE : observer;
  }

  /** The planned entry with this id, else the fallback. Execution may take branches the preview could not foresee. */
  FixPlanEntry entryFor(String id, FixPlanEntry fallback) {
    FixPlanEntry planned = planById.get(id);
    if (planned != null) {
      return planned;
    }
    if (fallback.id() == null || fallback.id().isBlank()) {
      return new FixPlanEntry(id, fallback.command(), fallback.summary());
    }
    return fallback;
  }

  void run(String id, FixPlanEntry fallback, Step step) {
    run(entryFor(id, fallback), step);
  }

  void run(FixPlanEntry entry, Step step) {
    emit(entry, StepStatus.RUNNING, null);
    log.info("{}", entry.summary());
    try {
      step.run();
    } catch (FixStepException e) {
      emit(entry, StepStatus.FAILED, e.getCause());
      throw e;
    } catch (FixIneligibleException e) {
      emit(entry, StepStatus.FAILED, e);
      throw e;
    } catch (Exception e) {
      emit(entry, StepStatus.FAILED, e);
      throw new FixStepException(entry, e);
    }
    emit(entry, StepStatus.DONE, null);
  }

  void skip(String id, FixPlanEntry fallback) {
    FixPlanEntry entry = entryFor(id, fallback);
    log.debug("skipped {}", entry);
    emit(entry, StepStatus.SKIPPED, null);
  }

  private void emit(FixPlanEntry entry, StepStatus status, Throwable error) {
    observer.onStep(new StepEvent(entry, status, error));
  }
}
