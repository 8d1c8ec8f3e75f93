package com.shardindex.router.inprocess;

import com.shardindex.core.indexer.JavaSymbolIndexer;
import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import com.shardindex.router.IShardRouter;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.error.RouterException;
import com.shardindex.router.index.GlobalSymbolIndex;
import com.shardindex.router.index.SymbolIndexHolder;
import com.shardindex.router.index.WorkspaceFiles;
import com.shardindex.router.metrics.RouterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Router that indexes every shard inside this process.
 * <p>
 * Each mutating call installs a fresh {@link CancellationToken} and cancels the previous one,
 * so at most the newest pass publishes. Indexing units check their token when they start and
 * again after indexing; a cancelled unit publishes nothing.
 * </p>
 */
public class InProcessRouter implements IShardRouter {
    private static final Logger log = LoggerFactory.getLogger(InProcessRouter.class);

    private final WorkspaceLayout layout;
    private final JavaSymbolIndexer indexer;
    private final RouterMetrics metrics;
    private final Scheduler scheduler;
    private final SymbolIndexHolder symbolIndex;
    private final AtomicLong revision = new AtomicLong();
    private final AtomicReference<CancellationToken> currentToken = new AtomicReference<>();

    private final Object shardLock = new Object();
    private final Map<Integer, ShardIndex> shards = new TreeMap<>();

    public InProcessRouter(WorkspaceLayout layout, JavaSymbolIndexer indexer, RouterMetrics metrics) {
        this(layout, indexer, metrics, Schedulers.boundedElastic());
    }

    InProcessRouter(WorkspaceLayout layout, JavaSymbolIndexer indexer, RouterMetrics metrics, Scheduler scheduler) {
        this.layout = layout;
        this.indexer = indexer;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.symbolIndex = new SymbolIndexHolder(metrics);
    }

    /**
     * Installs a fresh token and cancels the one it replaces.
     */
    CancellationToken nextIndexToken() {
        CancellationToken token = new CancellationToken();
        CancellationToken previous = currentToken.getAndSet(token);
        if (previous != null) {
            previous.cancel();
        }
        return token;
    }

    @Override
    public Mono<Void> indexWorkspace() {
        return Mono.defer(() -> {
            CancellationToken token = nextIndexToken();
            long rev = revision.incrementAndGet();
            int shardCount = layout.shardCount();
            return Flux.range(0, shardCount)
                .flatMap(shard -> indexShard(shard, rev, token, null, "index_shard"))
                .collectList()
                .flatMap(indexes -> {
                    if (token.isCancelled() || indexes.size() != shardCount) {
                        log.debug("Workspace index at revision {} superseded, not publishing", rev);
                        return Mono.empty();
                    }
                    commitWorkspace(token, rev, indexes);
                    return Mono.empty();
                });
        });
    }

    @Override
    public Mono<Void> updateFile(Path path, String text) {
        return Mono.defer(() -> {
            OptionalInt shard = layout.shardForPath(path);
            if (shard.isEmpty()) {
                return Mono.error(new RouterException("no source root contains " + path));
            }
            CancellationToken token = nextIndexToken();
            long rev = revision.incrementAndGet();
            return indexShard(shard.getAsInt(), rev, token, new FileText(path.toString(), text), "update_file")
                .doOnNext(index -> commitShard(token, rev, index))
                .then();
        });
    }

    /**
     * One background unit: reads the shard's files, applying {@code override} if given, and
     * indexes them. Empty when cancelled (a null callable result completes the Mono empty).
     */
    private Mono<ShardIndex> indexShard(int shardId,
                                        long rev,
                                        CancellationToken token,
                                        FileText override,
                                        String type) {
        return Mono.fromCallable(() -> {
                if (token.isCancelled()) {
                    return null;
                }
                long start = System.nanoTime();
                List<FileText> files = shardFiles(shardId, override);
                List<Symbol> symbols = new ArrayList<>(new TreeSet<>(indexer.indexFiles(files)));
                if (token.isCancelled()) {
                    return null;
                }
                metrics.recordShardIndex(type, true, Duration.ofNanos(System.nanoTime() - start));
                return new ShardIndex(shardId, rev, rev, symbols);
            })
            .subscribeOn(scheduler);
    }

    private List<FileText> shardFiles(int shardId, FileText override) {
        List<Path> paths = new ArrayList<>(WorkspaceFiles.listJavaFiles(layout.root(shardId)));
        if (override == null) {
            return WorkspaceFiles.read(paths);
        }
        Path overridePath = Path.of(override.getPath());
        paths.remove(overridePath);
        List<FileText> files = WorkspaceFiles.read(paths);
        files.add(override);
        files.sort((a, b) -> a.getPath().compareTo(b.getPath()));
        return files;
    }

    private void commitWorkspace(CancellationToken token, long rev, List<ShardIndex> indexes) {
        List<ShardIndex> snapshot;
        synchronized (shardLock) {
            if (token.isCancelled()) {
                return;
            }
            shards.clear();
            for (ShardIndex index : indexes) {
                shards.put(index.getShardId(), index);
            }
            snapshot = new ArrayList<>(shards.values());
        }
        symbolIndex.write(rev, GlobalSymbolIndex.build(snapshot));
        log.info("Published workspace index at revision {} ({} shards)", rev, snapshot.size());
    }

    private void commitShard(CancellationToken token, long rev, ShardIndex index) {
        List<ShardIndex> snapshot;
        synchronized (shardLock) {
            if (token.isCancelled()) {
                return;
            }
            shards.put(index.getShardId(), index);
            snapshot = new ArrayList<>(shards.values());
        }
        symbolIndex.write(rev, GlobalSymbolIndex.build(snapshot));
    }

    @Override
    public Mono<Map<Integer, WorkerStats>> workerStats() {
        return Mono.just(Map.of());
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            CancellationToken token = currentToken.getAndSet(null);
            if (token != null) {
                token.cancel();
            }
        });
    }

    @Override
    public List<Symbol> workspaceSymbols(String query, int limit) {
        return symbolIndex.search(query, limit);
    }

    @Override
    public long revision() {
        return revision.get();
    }

    public Optional<ShardIndex> shardIndex(int shardId) {
        synchronized (shardLock) {
            return Optional.ofNullable(shards.get(shardId));
        }
    }
}
