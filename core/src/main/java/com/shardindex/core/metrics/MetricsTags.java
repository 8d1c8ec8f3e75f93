package com.shardindex.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for shard identifier.
     */
    public static final String SHARD = "shard";

    /**
     * Tag key for request type (index_shard/update_file).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for success/failure outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for failure/rejection reason.
     */
    public static final String REASON = "reason";
}
