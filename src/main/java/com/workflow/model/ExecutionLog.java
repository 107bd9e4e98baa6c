package com.workflow.model;

import java.util.List;
import java.util.Objects;

/**
 * The ordered record of per-step outcomes for one run.
 * <p>
 * There is one entry per attempted step; steps after a failure or cancellation never appear,
 * so the log is never longer than the plan. Instances are immutable.
 *
 * @param results The step results, in plan order.
 * @param status  The overall status of the run.
 */
public record ExecutionLog(List<StepResult> results, RunStatus status) {

    public ExecutionLog {
        Objects.requireNonNull(status, "status must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public StepResult get(int index) {
        return results.get(index);
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public StepResult lastResult() {
        return results.isEmpty() ? null : results.get(results.size() - 1);
    }
}
