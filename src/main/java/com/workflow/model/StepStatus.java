package com.workflow.model;

/**
 * The outcome of one attempted step.
 */
public enum StepStatus {
    /**
     * The handler returned normally; the result carries its payload.
     */
    SUCCESS,
    /**
     * The handler (or parameter resolution) failed; the run stops after this step.
     */
    FAILURE,
    /**
     * The step was not run, for example because no handler is registered for its action.
     */
    SKIPPED
}
