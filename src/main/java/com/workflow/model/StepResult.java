package com.workflow.model;

import java.time.Duration;
import java.util.Objects;

/**
 * The recorded outcome of one attempted {@link Step}. Exactly one is produced per attempt.
 *
 * @param step     The step that was attempted.
 * @param status   Whether the step succeeded, failed, or was skipped.
 * @param payload  The handler's return value; only set for {@link StepStatus#SUCCESS}.
 * @param error    The failure message; only set for {@link StepStatus#FAILURE}.
 * @param reason   Why the step was skipped; only set for {@link StepStatus#SKIPPED}.
 * @param duration Wall-clock time spent on the step.
 */
public record StepResult(Step step, StepStatus status, Object payload, String error, String reason, Duration duration) {

    public StepResult {
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(status, "status must not be null");
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static StepResult success(Step step, Object payload, Duration duration) {
        return new StepResult(step, StepStatus.SUCCESS, payload, null, null, duration);
    }

    public static StepResult failure(Step step, String error, Duration duration) {
        return new StepResult(step, StepStatus.FAILURE, null, error, null, duration);
    }

    public static StepResult skipped(Step step, String reason) {
        return new StepResult(step, StepStatus.SKIPPED, null, null, reason, Duration.ZERO);
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == StepStatus.FAILURE;
    }

    public boolean isSkipped() {
        return status == StepStatus.SKIPPED;
    }
}
