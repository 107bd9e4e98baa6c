package com.workflow.model;

import java.util.List;

/**
 * The fixed recipe used to plan one intent category.
 *
 * @param category           The category this template handles.
 * @param description        A short, operator-facing description.
 * @param requiredParameters Intent parameters that must be present and non-blank.
 * @param steps              The step recipes, in execution order.
 */
public record PlanTemplate(String category, String description, List<String> requiredParameters, List<StepTemplate> steps) {

    public PlanTemplate {
        requiredParameters = List.copyOf(requiredParameters);
        steps = List.copyOf(steps);
    }
}
