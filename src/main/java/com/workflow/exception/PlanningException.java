package com.workflow.exception;

import java.util.List;

/**
 * Thrown when an intent names a known category but cannot be turned into a plan,
 * typically because required parameters are missing. No partial plan is ever produced.
 */
public class PlanningException extends WorkflowException {

    private final String category;
    private final List<String> missingParameters;

    public PlanningException(String category, List<String> missingParameters) {
        super("Cannot plan '" + category + "': missing required parameter(s) " + String.join(", ", missingParameters));
        this.category = category;
        this.missingParameters = List.copyOf(missingParameters);
    }

    public String getCategory() {
        return category;
    }

    public List<String> getMissingParameters() {
        return missingParameters;
    }
}
