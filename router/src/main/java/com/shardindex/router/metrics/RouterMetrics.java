package com.shardindex.router.metrics;

import com.shardindex.core.metrics.MetricsNames;
import com.shardindex.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the router.
 */
public class RouterMetrics {
    @Getter
    private final MeterRegistry registry;

    private final Counter handshakesAccepted;

    // Gauge backing values
    private final AtomicInteger connectedWorkers = new AtomicInteger();
    private final AtomicInteger globalSymbols = new AtomicInteger();

    private final Timer symbolSearchLatency;

    public RouterMetrics(MeterRegistry registry) {
        this.registry = registry;

        handshakesAccepted = Counter.builder(MetricsNames.HANDSHAKES_TOTAL)
            .tag(MetricsTags.OUTCOME, "accepted")
            .tag(MetricsTags.REASON, "none")
            .description("Worker handshakes accepted")
            .register(registry);

        Gauge.builder(MetricsNames.CONNECTED_WORKERS, connectedWorkers, AtomicInteger::get)
            .description("Workers currently connected")
            .register(registry);

        Gauge.builder(MetricsNames.GLOBAL_SYMBOLS, globalSymbols, AtomicInteger::get)
            .description("Symbols in the global index")
            .register(registry);

        symbolSearchLatency = Timer.builder(MetricsNames.SYMBOL_SEARCH_LATENCY)
            .description("Workspace symbol search latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(100)
            )
            .register(registry);
    }

    /**
     * Metrics kept in memory only; used when the embedding application supplies no registry.
     */
    public static RouterMetrics inMemory() {
        return new RouterMetrics(new SimpleMeterRegistry());
    }

    public void recordHandshakeAccepted() {
        handshakesAccepted.increment();
    }

    public void recordHandshakeRejected(String reason) {
        Counter.builder(MetricsNames.HANDSHAKES_TOTAL)
            .tag(MetricsTags.OUTCOME, "rejected")
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void workerConnected() {
        connectedWorkers.incrementAndGet();
    }

    public void workerDisconnected() {
        connectedWorkers.decrementAndGet();
    }

    public int connectedWorkers() {
        return connectedWorkers.get();
    }

    public void recordWorkerRestart(int shardId) {
        Counter.builder(MetricsNames.WORKER_RESTARTS_TOTAL)
            .tag(MetricsTags.SHARD, String.valueOf(shardId))
            .description("Worker restarts scheduled by supervisors")
            .register(registry)
            .increment();
    }

    /**
     * Records one shard indexing round-trip.
     *
     * @param type     {@code index_shard} or {@code update_file}
     * @param success  Whether a shard index came back
     * @param duration Time from request to result
     */
    public void recordShardIndex(String type, boolean success, Duration duration) {
        Counter.builder(MetricsNames.INDEX_REQUESTS_TOTAL)
            .tag(MetricsTags.TYPE, type)
            .tag(MetricsTags.OUTCOME, success ? "success" : "failure")
            .register(registry)
            .increment();
        if (success) {
            Timer.builder(MetricsNames.SHARD_INDEX_LATENCY)
                .tag(MetricsTags.TYPE, type)
                .register(registry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    public void recordSymbolSearch(long nanos) {
        symbolSearchLatency.record(nanos, TimeUnit.NANOSECONDS);
    }

    public void setGlobalSymbols(int count) {
        globalSymbols.set(count);
    }
}
