package com.workflow.exception;

/**
 * Signals a handler failure that may succeed if attempted again, such as a refused
 * connection or an overloaded remote service. Only retry decorators act on the distinction;
 * the execution engine treats it like any other failure.
 */
public class TransientActionException extends WorkflowException {

    public TransientActionException(String message) {
        super(message);
    }

    public TransientActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
