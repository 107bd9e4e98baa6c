package com.workflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single unit of work within a {@link Plan}: the action to dispatch, the parameters bound
 * to it, and its ordinal position in the plan.
 * <p>
 * Parameter values are either plain values copied from the intent or {@link StepReference}s
 * that the engine resolves against earlier results of the same run.
 *
 * @param action     The identifier used to resolve an action handler (e.g. {@code fetch_crm}).
 * @param parameters The parameters bound to this step, in insertion order. Never {@code null}.
 * @param index      The zero-based position of this step in its plan.
 */
public record Step(String action, Map<String, Object> parameters, int index) {

    public Step {
        Objects.requireNonNull(action, "action must not be null");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Human-facing step number, starting at 1.
     */
    public int number() {
        return index + 1;
    }
}
