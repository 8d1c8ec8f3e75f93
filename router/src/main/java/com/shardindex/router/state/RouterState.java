package com.shardindex.router.state;

import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.error.HandshakeRejectedException;
import com.shardindex.router.error.RouterShutdownException;
import com.shardindex.router.error.WorkerTimeoutException;
import com.shardindex.router.index.GlobalSymbolIndex;
import com.shardindex.router.index.SymbolIndexHolder;
import com.shardindex.router.index.WorkspaceFiles;
import com.shardindex.router.metrics.RouterMetrics;
import com.shardindex.router.worker.WorkerHandle;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared state of a distributed router: shard connections, shard indexes, the global revision
 * and the global symbol index.
 * <p>
 * Connections and indexes sit behind separate locks so a slow index rebuild never blocks a
 * handshake. Every change to either fires {@link #changes()}.
 * </p>
 */
public class RouterState {
    private static final Logger log = LoggerFactory.getLogger(RouterState.class);

    /**
     * Shards whose files may be read at the same time.
     */
    static final int MAX_CONCURRENT_SNAPSHOTS = 2;

    @Getter
    private final WorkspaceLayout layout;
    @Getter
    private final DistributedRouterConfig config;
    @Getter
    private final RouterMetrics metrics;
    @Getter
    private final SymbolIndexHolder symbolIndex;

    private final ChangeSignal changes = new ChangeSignal();
    private final AtomicInteger nextWorkerId = new AtomicInteger(1);
    private final AtomicLong revision = new AtomicLong();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final Sinks.Empty<Void> shutdownSink = Sinks.empty();
    private final Scheduler snapshotScheduler;

    private final Object shardLock = new Object();
    private final List<ShardState> shards;

    private final Object indexLock = new Object();
    private final Map<Integer, ShardIndex> shardIndexes = new TreeMap<>();
    private long indexUpdates;

    public RouterState(WorkspaceLayout layout, DistributedRouterConfig config, RouterMetrics metrics) {
        this.layout = layout;
        this.config = config;
        this.metrics = metrics;
        this.symbolIndex = new SymbolIndexHolder(metrics);
        this.snapshotScheduler = Schedulers.newBoundedElastic(
            MAX_CONCURRENT_SNAPSHOTS, Integer.MAX_VALUE, "shard-snapshot", 60, true);
        this.shards = new ArrayList<>(layout.shardCount());
        for (int i = 0; i < layout.shardCount(); i++) {
            shards.add(new ShardState(i, layout.root(i)));
        }
    }

    // ========== Revision ==========

    public long revision() {
        return revision.get();
    }

    public long bumpRevision() {
        return revision.incrementAndGet();
    }

    /**
     * Raises the global revision to at least {@code seen}; never lowers it.
     */
    public long foldRevision(long seen) {
        return revision.accumulateAndGet(seen, Math::max);
    }

    // ========== Workers ==========

    public boolean hasShard(int shardId) {
        return layout.hasShard(shardId);
    }

    /**
     * Reserves a fresh worker id for a handshake on {@code shardId}.
     *
     * @throws HandshakeRejectedException if the shard is unknown or already has a worker,
     *                                    connected or mid-handshake
     */
    public int reserveWorker(int shardId) {
        synchronized (shardLock) {
            if (!hasShard(shardId)) {
                throw new HandshakeRejectedException("unknown_shard", "unknown shard " + shardId);
            }
            ShardState shard = shards.get(shardId);
            if (shard.isOccupied()) {
                throw new HandshakeRejectedException("duplicate",
                    "shard " + shardId + " already has a connected worker");
            }
            int workerId = nextWorkerId.getAndIncrement();
            shard.reserve(workerId);
            return workerId;
        }
    }

    public void releasePending(int shardId, int workerId) {
        boolean released;
        synchronized (shardLock) {
            released = hasShard(shardId) && shards.get(shardId).releasePending(workerId);
        }
        if (released) {
            changes.fire();
        }
    }

    /**
     * Turns the handle's reservation into the shard's connected worker.
     *
     * @return false if the reservation is gone
     */
    public boolean installWorker(WorkerHandle handle) {
        boolean installed;
        synchronized (shardLock) {
            installed = !shuttingDown.get() && shards.get(handle.getShardId()).install(handle);
        }
        if (installed) {
            metrics.workerConnected();
            changes.fire();
        }
        return installed;
    }

    /**
     * Clears the shard's worker and pending reservation, but only when they still belong to
     * {@code workerId}.
     */
    public void removeWorker(int shardId, int workerId) {
        boolean removed;
        boolean released;
        synchronized (shardLock) {
            ShardState shard = shards.get(shardId);
            removed = shard.removeWorker(workerId);
            released = shard.releasePending(workerId);
        }
        if (removed) {
            metrics.workerDisconnected();
            log.info("Worker {} for shard {} disconnected", workerId, shardId);
        }
        if (removed || released) {
            changes.fire();
        }
    }

    /**
     * Closes the shard's connection if it still belongs to {@code workerId} and clears it.
     */
    public void disconnectWorker(int shardId, int workerId) {
        worker(shardId)
            .filter(handle -> handle.getWorkerId() == workerId)
            .ifPresent(WorkerHandle::close);
        removeWorker(shardId, workerId);
    }

    public Optional<WorkerHandle> worker(int shardId) {
        synchronized (shardLock) {
            return Optional.ofNullable(shards.get(shardId).getWorker());
        }
    }

    public OptionalInt currentWorkerId(int shardId) {
        return worker(shardId).map(w -> OptionalInt.of(w.getWorkerId())).orElse(OptionalInt.empty());
    }

    public List<WorkerHandle> workers() {
        List<WorkerHandle> out = new ArrayList<>();
        synchronized (shardLock) {
            for (ShardState shard : shards) {
                if (shard.getWorker() != null) {
                    out.add(shard.getWorker());
                }
            }
        }
        return out;
    }

    /**
     * Waits until {@code shardId} has a connected worker.
     * <p>
     * Errors with {@link WorkerTimeoutException} after the configured wait timeout and with
     * {@link RouterShutdownException} once shutdown started.
     * </p>
     */
    public Mono<WorkerHandle> waitForWorker(int shardId) {
        if (!hasShard(shardId)) {
            return Mono.error(new IllegalArgumentException("unknown shard " + shardId));
        }
        return changes.changes()
            .<WorkerHandle>handle((version, sink) -> {
                if (shuttingDown.get()) {
                    sink.error(new RouterShutdownException("router is shutting down"));
                    return;
                }
                worker(shardId).ifPresent(sink::next);
            })
            .next()
            .switchIfEmpty(Mono.error(() -> new RouterShutdownException("router is shutting down")))
            .timeout(config.getWorkerWaitTimeout(), Mono.error(() -> new WorkerTimeoutException(
                "timed out after " + config.getWorkerWaitTimeout().toMillis()
                    + " ms waiting for a worker on shard " + shardId)));
    }

    public ChangeSignal changes() {
        return changes;
    }

    // ========== Shard indexes ==========

    /**
     * Stores {@code index} unless the shard already has a newer one, then rebuilds the global
     * symbol index from all shard indexes.
     *
     * @return false if the index was stale
     */
    public boolean applyShardIndex(ShardIndex index) {
        long updateId;
        GlobalSymbolIndex built;
        synchronized (indexLock) {
            ShardIndex current = shardIndexes.get(index.getShardId());
            if (index.isOlderThan(current)) {
                log.debug("Dropping stale index {} for shard {} (have {})", index, index.getShardId(), current);
                return false;
            }
            Map<Integer, ShardIndex> next = new TreeMap<>(shardIndexes);
            next.put(index.getShardId(), index);
            // the shard map only changes once the merged index was built
            built = GlobalSymbolIndex.build(next.values());
            shardIndexes.put(index.getShardId(), index);
            updateId = ++indexUpdates;
        }
        symbolIndex.write(updateId, built);
        changes.fire();
        return true;
    }

    public void clearIndexes() {
        long updateId;
        synchronized (indexLock) {
            shardIndexes.clear();
            updateId = ++indexUpdates;
        }
        symbolIndex.write(updateId, GlobalSymbolIndex.empty());
        changes.fire();
    }

    public Optional<ShardIndex> shardIndex(int shardId) {
        synchronized (indexLock) {
            return Optional.ofNullable(shardIndexes.get(shardId));
        }
    }

    /**
     * Reads the shard's sources; at most {@value #MAX_CONCURRENT_SNAPSHOTS} shards at a time.
     */
    public Mono<List<FileText>> collectFiles(int shardId) {
        return WorkspaceFiles.collect(layout.root(shardId), snapshotScheduler);
    }

    // ========== Shutdown ==========

    /**
     * Starts shutdown: fires the shutdown broadcast and wakes every waiter.
     *
     * @return false if shutdown had already begun
     */
    public boolean beginShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return false;
        }
        shutdownSink.tryEmitEmpty();
        changes.fire();
        return true;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Completes when shutdown begins.
     */
    public Mono<Void> shutdownSignal() {
        return shutdownSink.asMono();
    }

    public void dispose() {
        changes.complete();
        snapshotScheduler.dispose();
    }
}
