package com.workflow.service.impl;

import com.workflow.action.ActionHandler;
import com.workflow.exception.WorkflowException;
import com.workflow.service.api.ActionHandlerRegistry;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link ConcurrentHashMap}-backed registry, safe for concurrent resolution from any number
 * of runs. Registration is strict: an identifier can be registered only once.
 */
@Slf4j
public class ActionHandlerRegistryImpl implements ActionHandlerRegistry {

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String identifier, ActionHandler handler) {
        if (identifier == null || identifier.isBlank()) {
            throw new WorkflowException("Action identifier must not be blank.");
        }
        if (handler == null) {
            throw new WorkflowException("Handler for action '" + identifier + "' must not be null.");
        }
        ActionHandler existing = handlers.putIfAbsent(identifier, handler);
        if (existing != null) {
            throw new WorkflowException("An action handler is already registered for '" + identifier + "'.");
        }
        log.info("Registered action handler '{}'", identifier);
    }

    @Override
    public Optional<ActionHandler> resolve(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(identifier));
    }

    @Override
    public Set<String> identifiers() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
