package com.shardindex.router.inprocess;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed to one indexing pass.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
