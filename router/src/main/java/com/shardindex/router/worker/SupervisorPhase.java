package com.shardindex.router.worker;

/**
 * Lifecycle of one shard's worker process.
 */
public enum SupervisorPhase {
    /**
     * Launching the process and waiting for it to connect.
     */
    SPAWNING,
    /**
     * Worker connected and serving.
     */
    RUNNING,
    /**
     * Waiting out the restart backoff.
     */
    BACKOFF,
    STOPPED
}
