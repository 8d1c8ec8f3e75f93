package com.shardindex.router.state;

import com.shardindex.router.worker.WorkerHandle;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Per-shard connection bookkeeping. Mutated only under {@link RouterState}'s shard lock.
 */
@Getter
public class ShardState {
    private final int shardId;
    private final Path root;

    private WorkerHandle worker;

    /**
     * Worker id reserved by a handshake that has not finished yet.
     */
    private Integer pendingWorkerId;

    ShardState(int shardId, Path root) {
        this.shardId = shardId;
        this.root = root;
    }

    boolean isOccupied() {
        return worker != null || pendingWorkerId != null;
    }

    void reserve(int workerId) {
        pendingWorkerId = workerId;
    }

    boolean install(WorkerHandle handle) {
        if (pendingWorkerId == null || pendingWorkerId != handle.getWorkerId()) {
            return false;
        }
        pendingWorkerId = null;
        worker = handle;
        return true;
    }

    boolean releasePending(int workerId) {
        if (pendingWorkerId != null && pendingWorkerId == workerId) {
            pendingWorkerId = null;
            return true;
        }
        return false;
    }

    boolean removeWorker(int workerId) {
        if (worker != null && worker.getWorkerId() == workerId) {
            worker = null;
            return true;
        }
        return false;
    }
}
