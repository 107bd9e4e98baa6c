package com.workflow.model;

import java.util.Map;
import java.util.function.Function;

/**
 * One entry of a {@link PlanTemplate}: a fixed action plus the function that binds intent
 * parameters into that step's parameter mapping.
 *
 * @param action The action identifier of the step.
 * @param binder Maps the intent parameters to the step parameters. Must be pure.
 */
public record StepTemplate(String action, Function<Map<String, Object>, Map<String, Object>> binder) {

    public Map<String, Object> bind(Map<String, Object> intentParameters) {
        return binder.apply(intentParameters);
    }
}
