package com.workflow.model;

import java.util.List;

/**
 * An ordered, immutable sequence of {@link Step}s produced for a single intent.
 * Steps are listed in exact execution order and step {@code i} has {@code index == i}.
 * Re-planning always produces a new instance.
 *
 * @param category The intent category the plan was built for.
 * @param steps    The steps, in execution order.
 */
public record Plan(String category, List<Step> steps) {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).index() != i) {
                throw new IllegalArgumentException("Step at position " + i + " (" + steps.get(i).action()
                        + ") has index " + steps.get(i).index());
            }
        }
    }

    public static Plan empty(String category) {
        return new Plan(category, List.of());
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
