package com.workflow.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller-owned flag that asks a running execution to stop before its next step.
 * Safe to set from any thread.
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A token that is never cancelled, for callers that do not need to stop runs.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
