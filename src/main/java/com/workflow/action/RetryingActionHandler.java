package com.workflow.action;

import com.workflow.exception.TransientActionException;
import io.github.resilience4j.retry.Retry;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorates an {@link ActionHandler} with a resilience4j {@link Retry}.
 * <p>
 * The retry is expected to be configured to act on {@link TransientActionException} only;
 * any other failure, and the last transient one once attempts are exhausted, propagates to
 * the engine unchanged.
 */
@Slf4j
public class RetryingActionHandler implements ActionHandler {

    private final String action;
    private final ActionHandler delegate;
    private final Retry retry;

    public RetryingActionHandler(String action, ActionHandler delegate, Retry retry) {
        this.action = action;
        this.delegate = delegate;
        this.retry = retry;
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying action '{}' (attempt {}) after: {}", action, event.getNumberOfRetryAttempts() + 1,
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
    }

    @Override
    public Object handle(Map<String, Object> parameters) {
        return retry.executeSupplier(() -> delegate.handle(parameters));
    }

    public String getAction() {
        return action;
    }
}
