package com.shardindex.router.index;

import com.shardindex.core.model.Symbol;
import com.shardindex.router.metrics.RouterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the current {@link GlobalSymbolIndex}. Writers replace it as a whole; readers never see
 * a partially built index.
 */
public class SymbolIndexHolder {
    private static final Logger log = LoggerFactory.getLogger(SymbolIndexHolder.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final RouterMetrics metrics;

    private GlobalSymbolIndex index = GlobalSymbolIndex.empty();
    private long updateId;

    public SymbolIndexHolder(RouterMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Installs {@code next} unless a later update already landed.
     *
     * @param nextUpdateId Monotonic id of the state {@code next} was built from
     * @param next         Replacement index
     * @return false if {@code nextUpdateId} is older than the installed one
     */
    public boolean write(long nextUpdateId, GlobalSymbolIndex next) {
        lock.writeLock().lock();
        try {
            if (nextUpdateId < updateId) {
                log.debug("Ignoring stale symbol index update {} (current {})", nextUpdateId, updateId);
                return false;
            }
            updateId = nextUpdateId;
            index = next;
        } finally {
            lock.writeLock().unlock();
        }
        metrics.setGlobalSymbols(next.size());
        return true;
    }

    public List<Symbol> search(String query, int limit) {
        long start = System.nanoTime();
        lock.readLock().lock();
        try {
            return index.search(query, limit);
        } finally {
            lock.readLock().unlock();
            metrics.recordSymbolSearch(System.nanoTime() - start);
        }
    }

    public GlobalSymbolIndex current() {
        lock.readLock().lock();
        try {
            return index;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long updateId() {
        lock.readLock().lock();
        try {
            return updateId;
        } finally {
            lock.readLock().unlock();
        }
    }
}
