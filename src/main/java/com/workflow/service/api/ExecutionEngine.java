package com.workflow.service.api;

import com.workflow.model.CancellationToken;
import com.workflow.model.ExecutionLog;
import com.workflow.model.Plan;

public interface ExecutionEngine {

    /**
     * Executes a plan against the given registry, in order, stopping at the first failure.
     *
     * @param plan     The {@link Plan} to execute.
     * @param registry The registry used to resolve each step's action.
     * @return The log of every attempted step and the overall run status. Never throws for
     *         errors raised by handlers.
     */
    default ExecutionLog run(Plan plan, ActionHandlerRegistry registry) {
        return run(plan, registry, CancellationToken.none());
    }

    /**
     * Executes a plan, checking the cancellation token before each step.
     *
     * @param plan         The {@link Plan} to execute.
     * @param registry     The registry used to resolve each step's action.
     * @param cancellation A caller-owned token; once cancelled, no further step is started.
     * @return The log accumulated so far, tagged {@code CANCELLED} if the run was stopped.
     */
    ExecutionLog run(Plan plan, ActionHandlerRegistry registry, CancellationToken cancellation);
}
