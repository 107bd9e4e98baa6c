package com.workflow.service.api;

import com.workflow.model.IntentSpecification;
import com.workflow.model.Plan;
import com.workflow.model.PlanTemplate;
import java.util.Collection;

public interface PlanBuilder {

    /**
     * Turns an intent into an ordered plan of steps.
     * <p>
     * The result is deterministic for a given intent. An unrecognized category yields an
     * empty plan rather than an error.
     *
     * @param intent The structured intent to plan.
     * @return A new, immutable {@link Plan}.
     * @throws com.workflow.exception.PlanningException if the category is known but a
     *         required parameter is missing.
     */
    Plan build(IntentSpecification intent);

    /**
     * @return The templates of every category this builder can plan.
     */
    Collection<PlanTemplate> categories();
}
