package com.shardindex.router.worker;

import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.core.util.RestartBackoff;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.state.RouterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one worker process running for a shard.
 * <p>
 * Each session spawns the worker, waits for it to connect, then races process exit, disconnect
 * and router shutdown. Anything but shutdown is followed by an exponential backoff pause and a
 * restart; spawn failures count as exits. A session that stayed connected for
 * {@link #STABLE_SESSION} resets the backoff.
 * </p>
 */
public class WorkerSupervisor {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    static final Duration INITIAL_BACKOFF = Duration.ofMillis(50);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(5);
    static final int JITTER_DIVISOR = 4;
    static final Duration STABLE_SESSION = Duration.ofSeconds(10);
    static final Duration KILL_TIMEOUT = Duration.ofSeconds(2);
    static final int MAX_LOG_LINE_CHARS = 64 * 1024;

    private enum Outcome {
        CONNECTED,
        CONNECT_TIMEOUT,
        EXITED,
        DISCONNECTED,
        SHUTDOWN
    }

    private final int shardId;
    private final RouterState state;
    private final List<String> command;
    private final RestartBackoff backoff = new RestartBackoff(INITIAL_BACKOFF, MAX_BACKOFF, JITTER_DIVISOR);
    private final AtomicReference<SupervisorPhase> phase = new AtomicReference<>(SupervisorPhase.SPAWNING);
    private final AtomicReference<Process> process = new AtomicReference<>();
    private final Sinks.Empty<Void> terminated = Sinks.empty();

    private volatile Disposable subscription;

    public WorkerSupervisor(int shardId, RouterState state, TransportAddress connectAddress) {
        this.shardId = shardId;
        this.state = state;
        this.command = buildCommand(state.getConfig(), connectAddress, shardId);
    }

    /**
     * Worker launch command: the configured executable and leading arguments, then the
     * connection parameters.
     */
    static List<String> buildCommand(DistributedRouterConfig config, TransportAddress connectAddress, int shardId) {
        List<String> args = new ArrayList<>(config.getWorkerCommand());
        args.add("--connect");
        args.add(connectAddress.toConnectArg());
        args.add("--shard-id");
        args.add(String.valueOf(shardId));
        args.add("--cache-dir");
        args.add(config.getCacheDir().toString());
        args.add("--max-frame-bytes");
        args.add(String.valueOf(config.getMaxFrameBytes()));
        if (config.getAuthToken() != null) {
            args.add("--auth-token");
            args.add(config.getAuthToken());
        }
        if (config.isAllowInsecureTcp() && connectAddress.getKind() == TransportKind.TCP) {
            args.add("--allow-insecure");
        }
        return args;
    }

    public void start() {
        subscription = Mono.defer(this::session)
            .repeat(() -> !state.isShuttingDown())
            .then()
            .doFinally(signal -> {
                phase.set(SupervisorPhase.STOPPED);
                terminated.tryEmitEmpty();
            })
            .subscribe(null, e -> log.error("Supervisor for shard {} failed", shardId, e));
    }

    /**
     * Completes once the supervisor loop has stopped.
     */
    public Mono<Void> terminated() {
        return terminated.asMono();
    }

    /**
     * Abandons the loop and kills the current process without waiting.
     */
    public void cancel() {
        if (subscription != null) {
            subscription.dispose();
        }
        Process current = process.getAndSet(null);
        if (current != null) {
            current.destroyForcibly();
        }
    }

    public SupervisorPhase phase() {
        return phase.get();
    }

    private Mono<Void> session() {
        if (state.isShuttingDown()) {
            return Mono.empty();
        }
        phase.set(SupervisorPhase.SPAWNING);
        int previousWorker = state.currentWorkerId(shardId).orElse(0);

        Process child;
        try {
            child = launch();
        } catch (IOException e) {
            log.warn("Failed to spawn worker for shard {}: {}", shardId, e.getMessage());
            return pause();
        }
        process.set(child);

        Mono<Outcome> connected = state.changes().changes()
            .filter(version -> isConnectedOtherThan(previousWorker))
            .next()
            .map(version -> Outcome.CONNECTED)
            .timeout(state.getConfig().getWorkerWaitTimeout(), Mono.just(Outcome.CONNECT_TIMEOUT));

        return Mono.firstWithSignal(connected, exited(child), shutdown())
            .flatMap(outcome -> {
                switch (outcome) {
                    case CONNECTED:
                        return running(child);
                    case EXITED:
                        log.warn("Worker for shard {} exited with code {} before connecting",
                            shardId, child.exitValue());
                        return pause();
                    case CONNECT_TIMEOUT:
                        log.warn("Worker for shard {} did not connect within {}, killing it",
                            shardId, state.getConfig().getWorkerWaitTimeout());
                        return kill(child).then(pause());
                    default:
                        return kill(child);
                }
            });
    }

    private Mono<Void> running(Process child) {
        OptionalInt current = state.currentWorkerId(shardId);
        if (current.isEmpty()) {
            return kill(child).then(pause());
        }
        int workerId = current.getAsInt();
        phase.set(SupervisorPhase.RUNNING);
        long startedAt = System.nanoTime();

        Mono<Outcome> disconnected = state.changes().changes()
            .filter(version -> state.currentWorkerId(shardId).orElse(0) != workerId)
            .next()
            .map(version -> Outcome.DISCONNECTED);

        return Mono.firstWithSignal(disconnected, exited(child), shutdown())
            .flatMap(outcome -> {
                Mono<Void> end;
                switch (outcome) {
                    case SHUTDOWN:
                        return kill(child);
                    case DISCONNECTED:
                        log.warn("Worker {} for shard {} disconnected, killing its process", workerId, shardId);
                        end = kill(child);
                        break;
                    default:
                        log.warn("Worker {} for shard {} exited with code {}", workerId, shardId, child.exitValue());
                        state.disconnectWorker(shardId, workerId);
                        end = Mono.empty();
                        break;
                }
                if (Duration.ofNanos(System.nanoTime() - startedAt).compareTo(STABLE_SESSION) >= 0) {
                    backoff.reset();
                }
                return end.then(pause());
            });
    }

    private boolean isConnectedOtherThan(int previousWorker) {
        OptionalInt current = state.currentWorkerId(shardId);
        return current.isPresent() && current.getAsInt() != previousWorker;
    }

    private Mono<Void> pause() {
        if (state.isShuttingDown()) {
            return Mono.empty();
        }
        phase.set(SupervisorPhase.BACKOFF);
        Duration delay = backoff.withJitter(backoff.nextDelay());
        state.getMetrics().recordWorkerRestart(shardId);
        log.info("Restarting worker for shard {} in {} ms", shardId, delay.toMillis());
        return Mono.firstWithSignal(Mono.delay(delay).then(), state.shutdownSignal());
    }

    private Process launch() throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        Process child = builder.start();
        log.info("Spawned worker for shard {} (pid {})", shardId, child.pid());
        Schedulers.boundedElastic().schedule(() -> pumpOutput(child));
        return child;
    }

    private void pumpOutput(Process child) {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8))) {
            StringBuilder line = new StringBuilder();
            boolean truncated = false;
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\n') {
                    logLine(line, truncated);
                    line.setLength(0);
                    truncated = false;
                } else if (c == '\r') {
                    continue;
                } else if (line.length() < MAX_LOG_LINE_CHARS) {
                    line.append((char) c);
                } else {
                    truncated = true;
                }
            }
            if (line.length() > 0) {
                logLine(line, truncated);
            }
        } catch (IOException e) {
            log.debug("Output of worker for shard {} closed: {}", shardId, e.toString());
        }
    }

    private void logLine(StringBuilder line, boolean truncated) {
        log.info("[shard-worker {}] {}{}", shardId, line, truncated ? " ...[truncated]" : "");
    }

    private Mono<Outcome> exited(Process child) {
        return Mono.fromFuture(child.onExit()).map(p -> Outcome.EXITED);
    }

    private Mono<Outcome> shutdown() {
        return state.shutdownSignal().thenReturn(Outcome.SHUTDOWN);
    }

    private Mono<Void> kill(Process child) {
        return Mono.fromRunnable(child::destroy)
            .then(Mono.fromFuture(child.onExit()).timeout(KILL_TIMEOUT))
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Worker for shard {} ignored termination, killing it forcibly", shardId);
                child.destroyForcibly();
                return Mono.fromFuture(child.onExit())
                    .timeout(KILL_TIMEOUT)
                    .onErrorResume(TimeoutException.class, again -> Mono.empty());
            })
            .doFinally(signal -> process.compareAndSet(child, null))
            .then();
    }
}
