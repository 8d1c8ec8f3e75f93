package com.shardindex.router;

import com.shardindex.core.indexer.RegexJavaSymbolIndexer;
import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.distributed.DistributedRouter;
import com.shardindex.router.inprocess.InProcessRouter;
import com.shardindex.router.metrics.RouterMetrics;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches workspace operations to the in-process or the distributed router.
 */
public class QueryRouter implements IQueryRouter {
    public static final int WORKSPACE_SYMBOLS_LIMIT = 200;

    private final IShardRouter delegate;
    private final TransportAddress boundAddress;

    private QueryRouter(IShardRouter delegate, TransportAddress boundAddress) {
        this.delegate = delegate;
        this.boundAddress = boundAddress;
    }

    public static QueryRouter inProcess(WorkspaceLayout layout) {
        return inProcess(layout, RouterMetrics.inMemory());
    }

    public static QueryRouter inProcess(WorkspaceLayout layout, RouterMetrics metrics) {
        return new QueryRouter(new InProcessRouter(layout, new RegexJavaSymbolIndexer(), metrics), null);
    }

    public static Mono<QueryRouter> distributed(DistributedRouterConfig config, WorkspaceLayout layout) {
        return distributed(config, layout, RouterMetrics.inMemory());
    }

    public static Mono<QueryRouter> distributed(DistributedRouterConfig config,
                                                WorkspaceLayout layout,
                                                RouterMetrics metrics) {
        return DistributedRouter.start(config, layout, metrics)
            .map(router -> new QueryRouter(router, router.getBoundAddress()));
    }

    @Override
    public Mono<Void> indexWorkspace() {
        return delegate.indexWorkspace();
    }

    @Override
    public Mono<Void> updateFile(Path path, String text) {
        return delegate.updateFile(path, text);
    }

    @Override
    public Mono<Map<Integer, WorkerStats>> workerStats() {
        return delegate.workerStats();
    }

    @Override
    public Mono<Void> shutdown() {
        return delegate.shutdown();
    }

    @Override
    public List<Symbol> workspaceSymbols(String query) {
        return delegate.workspaceSymbols(query, WORKSPACE_SYMBOLS_LIMIT);
    }

    @Override
    public Optional<TransportAddress> boundListenAddress() {
        return Optional.ofNullable(boundAddress);
    }

    public long revision() {
        return delegate.revision();
    }
}
