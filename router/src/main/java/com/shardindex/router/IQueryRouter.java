package com.shardindex.router;

import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import com.shardindex.core.transport.TransportAddress;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workspace-level entry point used by the editor-facing API.
 */
public interface IQueryRouter {
    Mono<Void> indexWorkspace();

    Mono<Void> updateFile(Path path, String text);

    Mono<Map<Integer, WorkerStats>> workerStats();

    Mono<Void> shutdown();

    /**
     * Ranked symbols matching {@code query}, at most {@link QueryRouter#WORKSPACE_SYMBOLS_LIMIT}.
     */
    List<Symbol> workspaceSymbols(String query);

    /**
     * Address workers connect to; empty in the in-process mode.
     */
    Optional<TransportAddress> boundListenAddress();
}
