package com.namekis.gitfleet.fix;

/** Receives step progress synchronously on the thread running the fix. Must not block. */
@FunctionalInterface
public interface StepObserver {
  StepObserver NONE = event -> {
  };

  void onStep(StepEvent event);
}
