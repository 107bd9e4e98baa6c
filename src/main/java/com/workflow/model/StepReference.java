package com.workflow.model;

/**
 * A parameter value that points at the payload of an earlier step in the same run.
 * <p>
 * The execution engine replaces it with that step's payload just before the handler is
 * invoked. When {@code jsonPath} is set, only the value at that path is passed on.
 *
 * @param stepIndex The zero-based index of the step whose payload is wanted.
 * @param jsonPath  An optional JsonPath expression applied to the payload, or {@code null}.
 */
public record StepReference(int stepIndex, String jsonPath) {

    public static StepReference to(int stepIndex) {
        return new StepReference(stepIndex, null);
    }

    public static StepReference to(int stepIndex, String jsonPath) {
        return new StepReference(stepIndex, jsonPath);
    }

    @Override
    public String toString() {
        return jsonPath == null ? "<step " + (stepIndex + 1) + ">" : "<step " + (stepIndex + 1) + " " + jsonPath + ">";
    }
}
