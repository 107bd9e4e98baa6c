package com.workflow.exception;

/**
 * Thrown by an action handler that cannot narrow its raw parameter map into the typed
 * values it needs (missing, wrong type or malformed).
 */
public class ActionParameterException extends WorkflowException {

    private final String action;
    private final String parameter;

    public ActionParameterException(String action, String parameter, String problem) {
        super("Invalid parameter '" + parameter + "' for action '" + action + "': " + problem);
        this.action = action;
        this.parameter = parameter;
    }

    public String getAction() {
        return action;
    }

    public String getParameter() {
        return parameter;
    }
}
