package com.workflow.action;

import java.util.Map;

/**
 * The single capability every connector exposes to the engine: given a parameter mapping,
 * produce a result or fail by throwing.
 * <p>
 * Handlers may block on I/O. They should narrow their parameters with {@link ActionParameters}
 * on entry so malformed input fails before any business logic runs.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Performs the action.
     *
     * @param parameters The step's parameters, with step references already resolved.
     * @return The payload recorded for the step; may be {@code null}.
     */
    Object handle(Map<String, Object> parameters);
}
