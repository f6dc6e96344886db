package com.liferx.brain.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative abort flag for one run. Tripped by the HTTP layer when the
 * client disconnects or times out, polled by the orchestrator between steps.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
