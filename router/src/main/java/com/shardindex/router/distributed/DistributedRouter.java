package com.shardindex.router.distributed;

import com.shardindex.core.cache.ShardCache;
import com.shardindex.core.codec.ProtocolException;
import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.msg.RpcMessages;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.router.IShardRouter;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.error.RouterException;
import com.shardindex.router.error.RouterShutdownException;
import com.shardindex.router.handshake.ConnectionHandler;
import com.shardindex.router.handshake.WorkerAdmission;
import com.shardindex.router.metrics.RouterMetrics;
import com.shardindex.router.state.RouterState;
import com.shardindex.router.transport.AcceptLoop;
import com.shardindex.router.transport.AcceptLoops;
import com.shardindex.router.worker.WorkerHandle;
import com.shardindex.router.worker.WorkerSupervisor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Router that runs every shard in a worker process reached over the configured transport.
 */
public class DistributedRouter implements IShardRouter {
    private static final Logger log = LoggerFactory.getLogger(DistributedRouter.class);

    static final Duration SHUTDOWN_GRACE = Duration.ofMillis(50);
    static final Duration JOIN_TIMEOUT = Duration.ofSeconds(1);

    @Getter
    private final RouterState state;
    private final AcceptLoop acceptLoop;
    @Getter
    private final TransportAddress boundAddress;
    private final List<WorkerSupervisor> supervisors;

    private DistributedRouter(RouterState state,
                              AcceptLoop acceptLoop,
                              TransportAddress boundAddress,
                              List<WorkerSupervisor> supervisors) {
        this.state = state;
        this.acceptLoop = acceptLoop;
        this.boundAddress = boundAddress;
        this.supervisors = supervisors;
    }

    /**
     * Validates the configuration, seeds shard indexes from the cache, starts accepting workers
     * and, when configured, spawns one supervised worker per shard.
     */
    public static Mono<DistributedRouter> start(DistributedRouterConfig config,
                                                WorkspaceLayout layout,
                                                RouterMetrics metrics) {
        return Mono.defer(() -> {
            DistributedRouterConfig validated = config.validated();
            RouterState state = new RouterState(layout, validated, metrics);
            seedFromCache(state);

            WorkerAdmission admission = new WorkerAdmission(
                state, validated.getAuthToken(), validated.getFingerprintAllowlist());
            ConnectionHandler handler = new ConnectionHandler(state, admission);
            AcceptLoop loop = AcceptLoops.create(
                validated.getListenAddress(), validated.getMaxFrameBytes(), handler::handle, state.shutdownSignal());

            return loop.start().map(bound -> {
                List<WorkerSupervisor> supervisors = new ArrayList<>();
                if (validated.isSpawnWorkers()) {
                    TransportAddress connect = connectAddress(bound);
                    for (int shard = 0; shard < layout.shardCount(); shard++) {
                        WorkerSupervisor supervisor = new WorkerSupervisor(shard, state, connect);
                        supervisor.start();
                        supervisors.add(supervisor);
                    }
                }
                log.info("Distributed router listening on {} for {} shards (revision {}, spawnWorkers={})",
                    bound, layout.shardCount(), state.revision(), validated.isSpawnWorkers());
                return new DistributedRouter(state, loop, bound, supervisors);
            });
        });
    }

    private static void seedFromCache(RouterState state) {
        Path cacheDir = state.getConfig().getCacheDir();
        if (cacheDir == null) {
            return;
        }
        ShardCache cache = new ShardCache(cacheDir);
        for (int shard = 0; shard < state.getLayout().shardCount(); shard++) {
            cache.load(shard).ifPresent(index -> {
                state.foldRevision(index.getRevision());
                state.applyShardIndex(index);
                log.info("Seeded shard {} from cache at revision {}", index.getShardId(), index.getRevision());
            });
        }
    }

    /**
     * Address spawned workers dial: a wildcard TCP bind is reached over loopback.
     */
    static TransportAddress connectAddress(TransportAddress bound) {
        if (bound.getKind() != TransportKind.TCP) {
            return bound;
        }
        String host = bound.getLocation();
        if ("0.0.0.0".equals(host)) {
            return TransportAddress.tcp("127.0.0.1", bound.getPort());
        }
        if ("::".equals(host) || "0:0:0:0:0:0:0:0".equals(host)) {
            return TransportAddress.tcp("::1", bound.getPort());
        }
        return bound;
    }

    @Override
    public Mono<Void> indexWorkspace() {
        return Mono.defer(() -> {
            ensureRunning();
            long revision = state.bumpRevision();
            int shardCount = state.getLayout().shardCount();
            if (shardCount == 0) {
                state.clearIndexes();
                return Mono.empty();
            }
            log.info("Indexing workspace at revision {} across {} shards", revision, shardCount);
            return Flux.range(0, shardCount)
                .flatMap(shard -> indexShard(shard, revision))
                .then();
        });
    }

    private Mono<Void> indexShard(int shardId, long revision) {
        return state.collectFiles(shardId)
            .zipWith(state.waitForWorker(shardId))
            .flatMap(filesAndWorker -> {
                List<FileText> files = filesAndWorker.getT1();
                WorkerHandle worker = filesAndWorker.getT2();
                return requestIndex(worker, new RpcMessages.IndexShard(revision, files), "index_shard");
            })
            .doOnNext(state::applyShardIndex)
            .then();
    }

    @Override
    public Mono<Void> updateFile(Path path, String text) {
        return Mono.defer(() -> {
            ensureRunning();
            OptionalInt shard = state.getLayout().shardForPath(path);
            if (shard.isEmpty()) {
                return Mono.error(new RouterException("no source root contains " + path));
            }
            int shardId = shard.getAsInt();
            long revision = state.bumpRevision();
            RpcMessages.UpdateFile update = new RpcMessages.UpdateFile(revision, new FileText(path.toString(), text));
            return state.waitForWorker(shardId)
                .flatMap(worker -> requestIndex(worker, update, "update_file"))
                .doOnNext(state::applyShardIndex)
                .then();
        });
    }

    private Mono<ShardIndex> requestIndex(WorkerHandle worker, RpcMessage request, String type) {
        long start = System.nanoTime();
        return worker.request(request)
            .map(reply -> {
                if (reply instanceof RpcMessages.ShardIndexResult) {
                    ShardIndex index = ((RpcMessages.ShardIndexResult) reply).getIndex();
                    if (index == null || index.getShardId() != worker.getShardId()) {
                        state.disconnectWorker(worker.getShardId(), worker.getWorkerId());
                        throw new ProtocolException("worker " + worker.getWorkerId() + " for shard "
                            + worker.getShardId() + " returned an index for shard "
                            + (index == null ? "<none>" : index.getShardId()));
                    }
                    return index;
                }
                throw unexpectedReply(worker, reply);
            })
            .doOnSuccess(index -> state.getMetrics().recordShardIndex(
                type, true, Duration.ofNanos(System.nanoTime() - start)))
            .doOnError(e -> {
                state.getMetrics().recordShardIndex(type, false, Duration.ofNanos(System.nanoTime() - start));
                log.warn("{} on shard {} failed: {}", type, worker.getShardId(), e.getMessage());
            });
    }

    @Override
    public Mono<Map<Integer, WorkerStats>> workerStats() {
        return Mono.defer(() -> {
            ensureRunning();
            return Flux.range(0, state.getLayout().shardCount())
                .flatMap(shard -> state.waitForWorker(shard)
                    .flatMap(this::requestStats))
                .collectMap(WorkerStats::getShardId, stats -> stats, TreeMap::new);
        });
    }

    private Mono<WorkerStats> requestStats(WorkerHandle worker) {
        return worker.request(new RpcMessages.GetWorkerStats())
            .map(reply -> {
                if (reply instanceof RpcMessages.WorkerStatsResult) {
                    WorkerStats stats = ((RpcMessages.WorkerStatsResult) reply).getStats();
                    if (stats == null || stats.getShardId() != worker.getShardId()) {
                        state.disconnectWorker(worker.getShardId(), worker.getWorkerId());
                        throw new ProtocolException("worker " + worker.getWorkerId() + " for shard "
                            + worker.getShardId() + " reported stats for another shard");
                    }
                    return stats;
                }
                throw unexpectedReply(worker, reply);
            });
    }

    private static ProtocolException unexpectedReply(WorkerHandle worker, RpcMessage reply) {
        if (reply instanceof RpcMessages.Error) {
            return new ProtocolException("worker " + worker.getWorkerId() + " for shard " + worker.getShardId()
                + " failed: " + ((RpcMessages.Error) reply).getMessage());
        }
        return new ProtocolException("unexpected reply " + reply.getClass().getSimpleName()
            + " from worker " + worker.getWorkerId());
    }

    /**
     * Stops the router. Safe to call repeatedly and with no workers connected.
     */
    @Override
    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!state.beginShutdown()) {
                return Mono.empty();
            }
            log.info("Shutting down distributed router");
            for (WorkerHandle worker : state.workers()) {
                worker.notifyWorker(new RpcMessages.Shutdown());
            }
            Mono<Void> joinAcceptLoop = acceptLoop.terminated()
                .timeout(JOIN_TIMEOUT)
                .onErrorResume(e -> {
                    log.warn("Accept loop did not stop within {}, forcing it", JOIN_TIMEOUT);
                    acceptLoop.stop();
                    return Mono.empty();
                });
            Mono<Void> joinSupervisors = Flux.fromIterable(supervisors)
                .flatMap(supervisor -> supervisor.terminated()
                    .timeout(JOIN_TIMEOUT)
                    .onErrorResume(e -> {
                        log.warn("Worker supervisor did not stop within {}, cancelling it", JOIN_TIMEOUT);
                        supervisor.cancel();
                        return Mono.empty();
                    }))
                .then();
            return Mono.delay(SHUTDOWN_GRACE)
                .then(joinAcceptLoop)
                .then(joinSupervisors)
                .then(Mono.fromRunnable(() -> {
                    for (WorkerHandle worker : state.workers()) {
                        worker.close();
                    }
                    acceptLoop.stop();
                    state.dispose();
                    log.info("Distributed router stopped");
                }));
        });
    }

    @Override
    public List<Symbol> workspaceSymbols(String query, int limit) {
        return state.getSymbolIndex().search(query, limit);
    }

    @Override
    public long revision() {
        return state.revision();
    }

    public Optional<ShardIndex> shardIndex(int shardId) {
        return state.shardIndex(shardId);
    }

    private void ensureRunning() {
        if (state.isShuttingDown()) {
            throw new RouterShutdownException("router is shut down");
        }
    }
}
