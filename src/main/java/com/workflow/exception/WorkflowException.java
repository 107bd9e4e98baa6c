package com.workflow.exception;

/**
 * Base of every failure the workflow agent raises on purpose: planning failures, rejected
 * action parameters and transient connector failures all extend it. Registry and plan
 * reference errors throw it directly.
 */
public class WorkflowException extends RuntimeException {

    /**
     * Constructs a new WorkflowException with the specified detail message.
     *
     * @param message The detail message.
     */
    public WorkflowException(String message) {
        super(message);
    }

    /**
     * Constructs a new WorkflowException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
