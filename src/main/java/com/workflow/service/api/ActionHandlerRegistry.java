package com.workflow.service.api;

import com.workflow.action.ActionHandler;
import java.util.Optional;
import java.util.Set;

/**
 * Routes action identifiers to {@link ActionHandler}s. The registry knows nothing about what
 * a handler does; it only maps identifiers, one handler per identifier.
 */
public interface ActionHandlerRegistry {

    /**
     * Registers a handler under an identifier.
     *
     * @param identifier The action identifier, e.g. {@code send_email}.
     * @param handler    The handler to invoke for steps with that action.
     * @throws com.workflow.exception.WorkflowException if the identifier is blank or already registered.
     */
    void register(String identifier, ActionHandler handler);

    /**
     * Looks up the handler for an identifier. Has no side effects.
     *
     * @param identifier The action identifier.
     * @return The handler, or empty if none is registered.
     */
    Optional<ActionHandler> resolve(String identifier);

    /**
     * @return The registered identifiers, sorted.
     */
    Set<String> identifiers();
}
