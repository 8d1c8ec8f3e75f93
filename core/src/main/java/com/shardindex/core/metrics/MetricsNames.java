package com.shardindex.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code shardindex.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Worker handshakes by outcome.
     * <p>
     * Tags: outcome (accepted/rejected), reason
     * </p>
     */
    public static final String HANDSHAKES_TOTAL = "shardindex.router.handshakes.total";

    /**
     * Gauge: Workers currently connected to the router.
     */
    public static final String CONNECTED_WORKERS = "shardindex.router.workers.connected";

    /**
     * Counter: Worker process restarts scheduled by supervisors.
     * <p>
     * Tags: shard
     * </p>
     */
    public static final String WORKER_RESTARTS_TOTAL = "shardindex.router.worker.restarts.total";

    /**
     * Counter: Indexing round-trips sent to workers or run in-process.
     * <p>
     * Tags: type (index_shard/update_file), outcome
     * </p>
     */
    public static final String INDEX_REQUESTS_TOTAL = "shardindex.router.index.requests.total";

    /**
     * Timer: Time to produce one shard index, measured at the router.
     * <p>
     * Tags: type (index_shard/update_file)
     * </p>
     */
    public static final String SHARD_INDEX_LATENCY = "shardindex.router.shard.index.latency";

    /**
     * Timer: Workspace symbol search latency.
     */
    public static final String SYMBOL_SEARCH_LATENCY = "shardindex.router.symbol.search.latency";

    /**
     * Gauge: Symbols in the current global index.
     */
    public static final String GLOBAL_SYMBOLS = "shardindex.router.symbols";
}
