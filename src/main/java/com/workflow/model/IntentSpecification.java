package com.workflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The structured description of what workflow to run, produced upstream of the planner.
 *
 * @param category   The task category, e.g. {@code generate-and-send-report}.
 * @param parameters Free-form named parameters (filter criteria, destination, output format).
 */
public record IntentSpecification(String category, Map<String, Object> parameters) {

    public IntentSpecification {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static IntentSpecification of(String category) {
        return new IntentSpecification(category, Map.of());
    }
}
