package com.workflow.model;

/**
 * Overall status of a run, returned alongside its {@link ExecutionLog}.
 */
public enum RunStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
