package com.namekis.gitfleet.fix;

/** @param error set only for {@link StepStatus#FAILED} */
public record StepEvent(FixPlanEntry entry, StepStatus status, Throwable error) {
}
