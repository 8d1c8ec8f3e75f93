package com.shardindex.router;

import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One way of running the shards: in this process or in supervised worker processes.
 */
public interface IShardRouter {
    /**
     * Re-indexes every shard under a new revision and publishes the result.
     */
    Mono<Void> indexWorkspace();

    /**
     * Re-indexes the shard owning {@code path} with {@code text} as the file's content.
     */
    Mono<Void> updateFile(Path path, String text);

    /**
     * Per-shard worker state. Empty when no workers are involved.
     */
    Mono<Map<Integer, WorkerStats>> workerStats();

    Mono<Void> shutdown();

    List<Symbol> workspaceSymbols(String query, int limit);

    /**
     * Current global revision.
     */
    long revision();
}
